package io.marcfilter.core;

import java.util.Objects;

/**
 * A generic record wrapper that carries a payload plus its position in the input.
 */
public final class Record<T> {
    private final long seq; // zero-based index across the whole input
    private final long offset; // byte offset within the current input stream, -1 when unknown
    private final T payload;

    public Record(long seq, long offset, T payload) {
        this.seq = seq;
        this.offset = offset;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public long offset() { return offset; }
    public T payload() { return payload; }

    /** Same position, new payload. Used by transforms so outputs keep the input's seq and offset. */
    public <O> Record<O> withPayload(O newPayload) {
        return new Record<>(seq, offset, newPayload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && offset == that.offset && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, offset, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", offset=" + offset +
                ", payload=" + payload +
                '}';
    }
}
