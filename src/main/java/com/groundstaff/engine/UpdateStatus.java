package com.groundstaff.engine;

public enum UpdateStatus {
    /** A new schedule version was committed. */
    COMMITTED,
    /** The solver proved or found no feasible schedule; the previous schedule stands. */
    UNRESOLVED,
    /** Timeout or solver error; nothing was committed and the caller may retry. */
    FAILED
}
