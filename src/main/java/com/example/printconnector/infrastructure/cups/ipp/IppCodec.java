package com.example.printconnector.infrastructure.cups.ipp;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the IPP/1.1 binary message format.
 */
public final class IppCodec {

    private static final int VERSION_MAJOR = 1;
    private static final int VERSION_MINOR = 1;

    private IppCodec() {
    }

    /**
     * Encodes a request: version, operation id, request id, the operation attribute group and the end tag.
     *
     * @param request request to encode
     * @return message bytes
     */
    public static byte[] encode(IppRequest request) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            out.writeByte(VERSION_MAJOR);
            out.writeByte(VERSION_MINOR);
            out.writeShort(request.operationId());
            out.writeInt(request.requestId());
            out.writeByte(IppTag.OPERATION_ATTRIBUTES);
            for (IppAttribute attribute : request.operationAttributes()) {
                writeAttribute(out, attribute);
            }
            out.writeByte(IppTag.END_OF_ATTRIBUTES);
        } catch (IOException ex) {
            throw new IllegalStateException("In-memory IPP encoding failed", ex);
        }
        return buffer.toByteArray();
    }

    private static void writeAttribute(DataOutputStream out, IppAttribute attribute) throws IOException {
        boolean first = true;
        for (String value : attribute.values()) {
            out.writeByte(attribute.valueTag());
            byte[] name = first ? attribute.name().getBytes(StandardCharsets.UTF_8) : new byte[0];
            out.writeShort(name.length);
            out.write(name);
            if (IppTag.isInteger(attribute.valueTag())) {
                out.writeShort(4);
                out.writeInt(Integer.parseInt(value));
            } else if (attribute.valueTag() == IppTag.BOOLEAN) {
                out.writeShort(1);
                out.writeByte(Boolean.parseBoolean(value) ? 1 : 0);
            } else {
                byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
                out.writeShort(bytes.length);
                out.write(bytes);
            }
            first = false;
        }
    }

    /**
     * Decodes a response. Additional values of a multi-valued attribute (empty name) are folded into the
     * preceding attribute.
     *
     * @param message response bytes
     * @return decoded response
     * @throws IOException when the message is truncated or malformed
     */
    public static IppResponse decode(byte[] message) throws IOException {
        DataInputStream in = new DataInputStream(new ByteArrayInputStream(message));
        in.readUnsignedByte();
        in.readUnsignedByte();
        int statusCode = in.readUnsignedShort();
        int requestId = in.readInt();

        List<IppAttributeGroup> groups = new ArrayList<>();
        int groupTag = -1;
        List<IppAttribute> attributes = new ArrayList<>();
        String currentName = null;
        int currentTag = 0;
        List<String> currentValues = new ArrayList<>();

        while (true) {
            int tag = in.readUnsignedByte();
            if (IppTag.isDelimiter(tag)) {
                if (currentName != null) {
                    attributes.add(new IppAttribute(currentTag, currentName, currentValues));
                    currentName = null;
                }
                if (groupTag >= 0) {
                    groups.add(new IppAttributeGroup(groupTag, attributes));
                }
                if (tag == IppTag.END_OF_ATTRIBUTES) {
                    return new IppResponse(statusCode, requestId, groups);
                }
                groupTag = tag;
                attributes = new ArrayList<>();
                continue;
            }
            if (groupTag < 0) {
                throw new IOException("IPP value tag 0x" + Integer.toHexString(tag) + " outside an attribute group");
            }

            String name = readString(in, in.readUnsignedShort());
            byte[] value = new byte[in.readUnsignedShort()];
            in.readFully(value);

            if (name.isEmpty()) {
                if (currentName == null) {
                    throw new IOException("IPP additional value without a preceding attribute");
                }
            } else {
                if (currentName != null) {
                    attributes.add(new IppAttribute(currentTag, currentName, currentValues));
                }
                currentName = name;
                currentTag = tag;
                currentValues = new ArrayList<>();
            }
            currentValues.add(decodeValue(tag, value));
        }
    }

    private static String decodeValue(int tag, byte[] value) throws IOException {
        if (IppTag.isInteger(tag)) {
            if (value.length != 4) {
                throw new IOException("IPP integer value of length " + value.length);
            }
            return Integer.toString(new DataInputStream(new ByteArrayInputStream(value)).readInt());
        }
        if (tag == IppTag.BOOLEAN) {
            return Boolean.toString(value.length > 0 && value[0] != 0);
        }
        return new String(value, StandardCharsets.UTF_8);
    }

    private static String readString(DataInputStream in, int length) throws IOException {
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
