package com.shlokmestry.flowlimit.paths;

import java.util.Objects;

/**
 * Lookup key for a set of rate limits: who moves value (owner), over which
 * channel, in which asset.
 */
public record Path(String owner, String channel, String asset) {

    public Path {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(asset, "asset");
    }

    @Override
    public String toString() {
        return owner + "/" + channel + "/" + asset;
    }
}
