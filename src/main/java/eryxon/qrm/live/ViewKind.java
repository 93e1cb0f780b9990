package eryxon.qrm.live;

import java.time.Duration;

/**
 * The live views a consumer can watch. Each kind carries the channel name
 * prefix used for its subscriptions and its default quiet window.
 */
public enum ViewKind {
    /** QRM metrics of one cell */
    CELL_METRICS("qrm-cell", Duration.ofMillis(150)),
    /** QRM metrics of every active cell of a tenant */
    ALL_CELL_METRICS("qrm-all-cells", Duration.ofMillis(300)),
    /** Capacity of the cell that follows a given cell */
    NEXT_CELL_CAPACITY("next-cell-capacity", Duration.ofMillis(150)),
    /** Routing of one part */
    PART_ROUTING("part-routing", Duration.ofMillis(150)),
    /** Routing of one job */
    JOB_ROUTING("job-routing", Duration.ofMillis(200)),
    /** Routing of a fixed set of jobs */
    JOBS_ROUTING("jobs-routing", Duration.ofMillis(300));

    private final String channelPrefix;
    private final Duration defaultQuietWindow;

    ViewKind(String channelPrefix, Duration defaultQuietWindow) {
        this.channelPrefix = channelPrefix;
        this.defaultQuietWindow = defaultQuietWindow;
    }

    public String channelPrefix() {
        return channelPrefix;
    }

    public Duration defaultQuietWindow() {
        return defaultQuietWindow;
    }
}
