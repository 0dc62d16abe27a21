package dev.flowdoctor.model;

/**
 * Numeric ranges node ids are allocated from. Reserved bands hold the startup and main-menu
 * sequences; every generated flow gets its own contiguous band above them.
 */
public record AllocationBands(
    int startupStart,
    int startupEnd,
    int menuStart,
    int menuEnd,
    int flowBase,
    int flowBandSize
) {
    public static final int DEFAULT_FLOW_BASE = 300;
    public static final int DEFAULT_FLOW_BAND_SIZE = 100;

    public AllocationBands {
        if (flowBandSize < 1) {
            throw new IllegalArgumentException("flowBandSize must be positive, got " + flowBandSize);
        }
        if (flowBase <= menuEnd) {
            throw new IllegalArgumentException("flow bands must start above the menu band");
        }
    }

    public static AllocationBands defaults() {
        return new AllocationBands(1, 199, 200, 299, DEFAULT_FLOW_BASE, DEFAULT_FLOW_BAND_SIZE);
    }

    public int bandStart(int flowIndex) {
        return flowBase + flowIndex * flowBandSize;
    }

    public int bandEnd(int flowIndex) {
        return bandStart(flowIndex) + flowBandSize - 1;
    }

    /** Flow band index holding the id, or -1 when the id lies below the flow bands. */
    public int bandOf(int id) {
        return id < flowBase ? -1 : (id - flowBase) / flowBandSize;
    }

    public boolean inReservedBand(int id) {
        return (id >= startupStart && id <= startupEnd) || (id >= menuStart && id <= menuEnd);
    }
}
