package io.marcfilter.marc.format;

import io.marcfilter.marc.codec.MarcEncodeException;
import io.marcfilter.marc.model.ControlField;
import io.marcfilter.marc.model.DataField;
import io.marcfilter.marc.model.Field;
import io.marcfilter.marc.model.MarcRecord;
import io.marcfilter.marc.model.Subfield;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static io.marcfilter.marc.model.MarcConstants.CODE_LABEL;
import static io.marcfilter.marc.model.MarcConstants.COLLECTION_LABEL;
import static io.marcfilter.marc.model.MarcConstants.CONTROLFIELD_LABEL;
import static io.marcfilter.marc.model.MarcConstants.DATAFIELD_LABEL;
import static io.marcfilter.marc.model.MarcConstants.IND1_LABEL;
import static io.marcfilter.marc.model.MarcConstants.IND2_LABEL;
import static io.marcfilter.marc.model.MarcConstants.LEADER_LABEL;
import static io.marcfilter.marc.model.MarcConstants.MARCXML_NAMESPACE;
import static io.marcfilter.marc.model.MarcConstants.RECORD_LABEL;
import static io.marcfilter.marc.model.MarcConstants.SUBFIELD_LABEL;
import static io.marcfilter.marc.model.MarcConstants.TAG_LABEL;

/**
 * MARCXML (MARC 21 slim). Files are wrapped in a {@code <collection>} element that declares the
 * namespace; each record is written as an unprefixed {@code <record>} in that default namespace.
 */
public class MarcXmlFormat extends RecordFormat {
    public static final String NAME = "xml";

    private static final XMLOutputFactory FACTORY = XMLOutputFactory.newFactory();
    private static final byte[] HEADER = ("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<" + COLLECTION_LABEL
            + " xmlns=\"" + MARCXML_NAMESPACE + "\">\n").getBytes(StandardCharsets.UTF_8);
    private static final byte[] FOOTER = ("\n</" + COLLECTION_LABEL + ">\n").getBytes(StandardCharsets.UTF_8);
    private static final byte[] NEWLINE = {'\n'};

    @Override
    public String name() { return NAME; }

    @Override
    public String extension() { return ".xml"; }

    @Override
    public byte[] header() { return HEADER; }

    @Override
    public byte[] footer() { return FOOTER; }

    @Override
    public byte[] multiSeparator() { return NEWLINE; }

    @Override
    public byte[] encode(MarcRecord record) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(1024);
        try {
            XMLStreamWriter w = FACTORY.createXMLStreamWriter(out, "UTF-8");
            w.writeStartElement(RECORD_LABEL);
            text(w, LEADER_LABEL, record.leader().value(), "leader");
            for (Field f : record.fields()) {
                if (f instanceof ControlField cf) {
                    w.writeStartElement(CONTROLFIELD_LABEL);
                    w.writeAttribute(TAG_LABEL, cf.tag());
                    w.writeCharacters(checked(cf.value(), "field " + cf.tag()));
                    w.writeEndElement();
                } else if (f instanceof DataField df) {
                    w.writeStartElement(DATAFIELD_LABEL);
                    w.writeAttribute(TAG_LABEL, df.tag());
                    w.writeAttribute(IND1_LABEL, checked(String.valueOf(df.ind1()), "field " + df.tag()));
                    w.writeAttribute(IND2_LABEL, checked(String.valueOf(df.ind2()), "field " + df.tag()));
                    for (Subfield s : df.subfields()) {
                        w.writeStartElement(SUBFIELD_LABEL);
                        w.writeAttribute(CODE_LABEL, checked(String.valueOf(s.code()), "field " + df.tag()));
                        w.writeCharacters(checked(s.value(), "field " + df.tag()));
                        w.writeEndElement();
                    }
                    w.writeEndElement();
                }
            }
            w.writeEndElement();
            w.flush();
            w.close();
        } catch (XMLStreamException e) {
            throw new MarcEncodeException("Cannot write record as XML: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    private static void text(XMLStreamWriter w, String element, String value, String where) throws XMLStreamException {
        w.writeStartElement(element);
        w.writeCharacters(checked(value, where));
        w.writeEndElement();
    }

    /** Rejects characters XML 1.0 cannot carry, including unpaired surrogates. */
    static String checked(String s, String where) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean ok;
            if (Character.isHighSurrogate(c)) {
                ok = i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1));
                if (ok) i++;
            } else if (Character.isLowSurrogate(c)) {
                ok = false;
            } else {
                ok = c == 0x9 || c == 0xA || c == 0xD || (c >= 0x20 && c <= 0xFFFD);
            }
            if (!ok) {
                throw new MarcEncodeException("The " + where + " has character U+" + String.format("%04X", (int) c)
                        + " which XML 1.0 cannot represent");
            }
        }
        return s;
    }
}
