package io.marcfilter.marc.codec;

import io.marcfilter.error.StreamFatalException;
import io.marcfilter.marc.model.ControlField;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.Field;
import io.marcfilter.marc.model.Leader;
import io.marcfilter.marc.model.MarcConstants;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.model.Subfield;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.marcfilter.marc.model.MarcConstants.DIRECTORY_ENTRY_LENGTH;
import static io.marcfilter.marc.model.MarcConstants.FIELD_TERMINATOR;
import static io.marcfilter.marc.model.MarcConstants.LEADER_LENGTH;
import static io.marcfilter.marc.model.MarcConstants.RECORD_TERMINATOR;
import static io.marcfilter.marc.model.MarcConstants.SUBFIELD_DELIMITER;

/**
 * Decodes ISO 2709 binary records from a stream, one per {@link #next()} call.
 * <p>
 * Each call reads the 24 byte leader, then exactly the remaining bytes the leader declares,
 * and never more; the stream is left at the next record boundary so arbitrarily large
 * concatenated files can be read with constant memory. The declared span is consumed before
 * the record's structure is checked, which is what lets a malformed record be skipped.
 * When the length digits themselves are unreadable the next boundary is unknown and the
 * decoder gives up with a {@link StreamFatalException}.
 * <p>
 * Content is decoded as UTF-8 when leader position 9 is {@code a}; otherwise bytes are
 * mapped one to one (ISO-8859-1) so MARC-8 data passes through unchanged.
 */
public class MarcDecoder implements RecordReader {
    private static final int MIN_RECORD_LENGTH = LEADER_LENGTH + 2; // directory terminator + record terminator

    private final InputStream in;
    private long position;
    private long index;
    private long lastOffset = -1;
    private boolean finished;

    public MarcDecoder(InputStream in) {
        this(in, 0);
    }

    /**
     * @param firstIndex index assigned to the first record; lets several streams share one numbering
     */
    public MarcDecoder(InputStream in, long firstIndex) {
        this.in = in;
        this.index = firstIndex;
    }

    @Override
    public Optional<MarcRecord> next() {
        if (finished) return Optional.empty();
        long start = position;
        lastOffset = start;
        byte[] leaderBytes = read(LEADER_LENGTH, start);
        if (leaderBytes.length == 0) {
            finished = true;
            return Optional.empty();
        }
        long recordIndex = index++;
        if (leaderBytes.length < LEADER_LENGTH) {
            finished = true;
            throw new MarcDecodeException("Truncated leader: stream ended after " + leaderBytes.length + " bytes",
                    recordIndex, start);
        }
        int declared = digits(leaderBytes, 0, 5);
        if (declared < MIN_RECORD_LENGTH) {
            finished = true;
            throw new StreamFatalException("Unreadable record length '"
                    + new String(leaderBytes, 0, 5, StandardCharsets.ISO_8859_1)
                    + "' in leader of record " + recordIndex + "; cannot locate the next record", start);
        }
        byte[] body = read(declared - LEADER_LENGTH, start);
        if (body.length < declared - LEADER_LENGTH) {
            finished = true;
            throw new MarcDecodeException("Truncated record: leader declares " + declared
                    + " bytes but stream ended after " + (LEADER_LENGTH + body.length), recordIndex, start);
        }
        byte[] data = new byte[declared];
        System.arraycopy(leaderBytes, 0, data, 0, LEADER_LENGTH);
        System.arraycopy(body, 0, data, LEADER_LENGTH, body.length);
        return Optional.of(decode(data, recordIndex, start));
    }

    @Override
    public long recordsRead() { return index; }

    @Override
    public long lastRecordOffset() { return lastOffset; }

    /** Bytes consumed from the stream so far. */
    public long position() { return position; }

    /**
     * Decodes one complete record held in {@code data}.
     *
     * @throws MarcDecodeException if the bytes are not a well formed record
     */
    public static MarcRecord decode(byte[] data, long recordIndex, long offset) {
        if (data.length < MIN_RECORD_LENGTH) {
            throw new MarcDecodeException("Record too short: " + data.length + " bytes", recordIndex, offset);
        }
        Leader leader = new Leader(new String(data, 0, LEADER_LENGTH, StandardCharsets.ISO_8859_1));
        int length = leader.recordLength();
        if (length != data.length) {
            throw new MarcDecodeException("Leader declares " + length + " bytes but record has " + data.length,
                    recordIndex, offset);
        }
        if (data[data.length - 1] != RECORD_TERMINATOR) {
            throw new MarcDecodeException("Record does not end with a record terminator", recordIndex, offset);
        }
        int base = leader.baseAddress();
        if (base == Leader.UNKNOWN || base <= LEADER_LENGTH || base > data.length - 1) {
            throw new MarcDecodeException("Invalid base address of data '" + leader.value().substring(12, 17) + "'",
                    recordIndex, offset);
        }
        if (data[base - 1] != FIELD_TERMINATOR) {
            throw new MarcDecodeException("Directory is not terminated at base address " + base, recordIndex, offset);
        }
        int directoryLength = base - 1 - LEADER_LENGTH;
        if (directoryLength % DIRECTORY_ENTRY_LENGTH != 0) {
            throw new MarcDecodeException("Directory length " + directoryLength + " is not a multiple of "
                    + DIRECTORY_ENTRY_LENGTH, recordIndex, offset);
        }

        Charset charset = leader.isUnicode() ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1;
        int indicatorCount = leader.indicatorCount();
        int codeLength = Math.max(1, leader.subfieldCodeLength() - 1);
        int dataEnd = data.length - 1;
        List<Field> fields = new ArrayList<>(directoryLength / DIRECTORY_ENTRY_LENGTH);
        for (int p = LEADER_LENGTH; p < base - 1; p += DIRECTORY_ENTRY_LENGTH) {
            String tag = new String(data, p, MarcConstants.TAG_LENGTH, StandardCharsets.ISO_8859_1);
            int fieldLength = digits(data, p + 3, 4);
            int fieldStart = digits(data, p + 7, 5);
            if (fieldLength < 1 || fieldStart < 0) {
                throw new MarcDecodeException("Malformed directory entry for tag " + tag, recordIndex, offset);
            }
            int from = base + fieldStart;
            int to = from + fieldLength;
            if (to > dataEnd) {
                throw new MarcDecodeException("Field " + tag + " extends past the end of the record", recordIndex, offset);
            }
            if (data[to - 1] != FIELD_TERMINATOR) {
                throw new MarcDecodeException("Field " + tag + " is missing its field terminator", recordIndex, offset);
            }
            if (MarcConstants.isControlTag(tag)) {
                fields.add(new ControlField(tag, new String(data, from, fieldLength - 1, charset)));
            } else {
                fields.add(decodeDataField(tag, data, from, to - 1, indicatorCount, codeLength, charset, recordIndex, offset));
            }
        }
        return new MarcRecord(leader, fields);
    }

    private static DataField decodeDataField(String tag, byte[] data, int from, int end, int indicatorCount,
                                             int codeLength, Charset charset, long recordIndex, long offset) {
        if (end - from < indicatorCount) {
            throw new MarcDecodeException("Field " + tag + " is too short for its indicators", recordIndex, offset);
        }
        char ind1 = indicatorCount > 0 ? (char) (data[from] & 0xFF) : ' ';
        char ind2 = indicatorCount > 1 ? (char) (data[from + 1] & 0xFF) : ' ';
        int p = from + indicatorCount;
        if (p < end && data[p] != SUBFIELD_DELIMITER) {
            throw new MarcDecodeException("Field " + tag + " has data before its first subfield delimiter",
                    recordIndex, offset);
        }
        List<Subfield> subfields = new ArrayList<>();
        while (p < end) {
            int next = p + 1;
            while (next < end && data[next] != SUBFIELD_DELIMITER) next++;
            if (next - p - 1 < codeLength) {
                throw new MarcDecodeException("Field " + tag + " has a subfield without a code", recordIndex, offset);
            }
            char code = (char) (data[p + 1] & 0xFF);
            int valueStart = p + 1 + codeLength;
            subfields.add(new Subfield(code, new String(data, valueStart, next - valueStart, charset)));
            p = next;
        }
        return new DataField(tag, ind1, ind2, subfields);
    }

    private byte[] read(int n, long recordStart) {
        try {
            byte[] b = in.readNBytes(n);
            position += b.length;
            return b;
        } catch (IOException e) {
            finished = true;
            throw new StreamFatalException("Read failed", recordStart, e);
        }
    }

    private static int digits(byte[] b, int from, int count) {
        int n = 0;
        for (int i = from; i < from + count; i++) {
            int c = b[i];
            if (c < '0' || c > '9') return -1;
            n = n * 10 + (c - '0');
        }
        return n;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
