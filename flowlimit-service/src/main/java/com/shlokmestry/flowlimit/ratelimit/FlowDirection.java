package com.shlokmestry.flowlimit.ratelimit;

public enum FlowDirection {
    /** Value received through the channel; bounded by the quota's receive cap. */
    IN,
    /** Value sent through the channel; bounded by the quota's send cap. */
    OUT
}
