package me.bechberger.dyntrace.symbolizer;

/**
 * Identifies a process across pid reuse
 *
 * @param pid            process id
 * @param startTimeTicks start time of the process, disambiguates reused pids
 */
public record UPID(int pid, long startTimeTicks) {

    /** the kernel address space */
    public static final UPID KERNEL = new UPID(-1, 0);

    public boolean isKernel() {
        return equals(KERNEL);
    }

    @Override
    public String toString() {
        return isKernel() ? "kernel" : pid + ":" + startTimeTicks;
    }
}
