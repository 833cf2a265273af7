package com.ordoAetheris.buffer;

/**
 * End of a {@link Buffer} used for insertion (push) or removal (pop).
 */
public enum PushPopType {
    FRONT,
    REAR
}
