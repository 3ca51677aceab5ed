package com.example.printconnector.infrastructure.cups.ipp;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the IPP binary message format.
 */
class IppCodecTest {

    /**
     * Verifies the header, the mandatory leading attributes and multi-valued keywords of an encoded request.
     *
     * @throws IOException never, the message is read from memory
     */
    @Test
    void encodeWritesHeaderAndAttributes() throws IOException {
        IppRequest request = IppRequest.of(IppOperation.CUPS_GET_PRINTERS, 7,
                IppAttribute.keyword("requested-attributes", "printer-name", "printer-state"));

        DataInputStream in = new DataInputStream(new ByteArrayInputStream(IppCodec.encode(request)));

        assertThat(in.readUnsignedByte()).isEqualTo(1);
        assertThat(in.readUnsignedByte()).isEqualTo(1);
        assertThat(in.readUnsignedShort()).isEqualTo(0x4002);
        assertThat(in.readInt()).isEqualTo(7);
        assertThat(in.readUnsignedByte()).isEqualTo(IppTag.OPERATION_ATTRIBUTES);
        assertThat(readAttribute(in)).containsExactly("71", "attributes-charset", "utf-8");
        assertThat(readAttribute(in)).containsExactly("72", "attributes-natural-language", "en-us");
        assertThat(readAttribute(in)).containsExactly("68", "requested-attributes", "printer-name");
        assertThat(readAttribute(in)).containsExactly("68", "", "printer-state");
        assertThat(in.readUnsignedByte()).isEqualTo(IppTag.END_OF_ATTRIBUTES);
        assertThat(in.available()).isZero();
    }

    /**
     * Verifies that groups are split on delimiters and additional values are folded into their attribute.
     *
     * @throws IOException when decoding fails
     */
    @Test
    void decodeFoldsAdditionalValues() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(buffer);
        out.writeShort(0x0101);
        out.writeShort(IppOperation.STATUS_OK);
        out.writeInt(3);
        out.writeByte(IppTag.OPERATION_ATTRIBUTES);
        writeText(out, IppTag.CHARSET, "attributes-charset", "utf-8");
        out.writeByte(IppTag.PRINTER_ATTRIBUTES);
        writeText(out, IppTag.NAME, "printer-name", "office");
        writeText(out, IppTag.KEYWORD, "document-format-supported", "application/pdf");
        writeText(out, IppTag.KEYWORD, "", "image/urf");
        out.writeByte(IppTag.ENUM);
        out.writeShort(13);
        out.write("printer-state".getBytes(StandardCharsets.UTF_8));
        out.writeShort(4);
        out.writeInt(3);
        out.writeByte(IppTag.PRINTER_ATTRIBUTES);
        writeText(out, IppTag.NAME, "printer-name", "lab");
        out.writeByte(IppTag.END_OF_ATTRIBUTES);

        IppResponse response = IppCodec.decode(buffer.toByteArray());

        assertThat(response.statusCode()).isEqualTo(IppOperation.STATUS_OK);
        assertThat(response.requestId()).isEqualTo(3);
        List<IppAttributeGroup> printers = response.groups(IppTag.PRINTER_ATTRIBUTES);
        assertThat(printers).hasSize(2);
        assertThat(printers.get(0).find("document-format-supported").orElseThrow().values())
                .containsExactly("application/pdf", "image/urf");
        assertThat(printers.get(0).find("printer-state").orElseThrow().firstValue()).isEqualTo("3");
        assertThat(printers.get(1).find("printer-name").orElseThrow().firstValue()).isEqualTo("lab");
    }

    /**
     * Ensures truncated messages are rejected.
     */
    @Test
    void decodeRejectsTruncatedMessage() {
        assertThrows(IOException.class, () -> IppCodec.decode(new byte[]{1, 1, 0, 0, 0, 0}));
    }

    private static void writeText(DataOutputStream out, int tag, String name, String value) throws IOException {
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        byte[] valueBytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeByte(tag);
        out.writeShort(nameBytes.length);
        out.write(nameBytes);
        out.writeShort(valueBytes.length);
        out.write(valueBytes);
    }

    private static List<String> readAttribute(DataInputStream in) throws IOException {
        int tag = in.readUnsignedByte();
        byte[] name = new byte[in.readUnsignedShort()];
        in.readFully(name);
        byte[] value = new byte[in.readUnsignedShort()];
        in.readFully(value);
        return List.of(Integer.toString(tag), new String(name, StandardCharsets.UTF_8),
                new String(value, StandardCharsets.UTF_8));
    }
}
