package com.geotokens.sim;

/** Why a collect or double attempt was refused. */
public enum Rejection {
    TOO_FAR,
    NO_TOKEN_IN_CELL,
    NO_TOKEN_HELD,
    VALUE_MISMATCH,
    /** Doubling would overflow the value range. */
    VALUE_TOO_LARGE
}
