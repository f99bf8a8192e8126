package com.shlokmestry.flowlimit.ratelimit;

import com.shlokmestry.flowlimit.paths.Path;

public class QuotaNotFoundException extends RuntimeException {

    private final Path path;
    private final String quotaName;

    public QuotaNotFoundException(Path path, String quotaName) {
        super("Quota " + quotaName + " not found for path " + path);
        this.path = path;
        this.quotaName = quotaName;
    }

    public Path getPath() {
        return path;
    }

    public String getQuotaName() {
        return quotaName;
    }
}
