package me.bechberger.dyntrace.ir;

/**
 * Runtime values that a probe can read without any argument,
 * all derived from {@code bpf_get_current_pid_tgid()}
 */
public enum BPFHelper {
    /** thread id, the lower 32 bits of the combined id */
    TID,
    /** process id, the upper 32 bits of the combined id */
    TGID,
    /** the combined process and thread id */
    TGID_PID
}
