package com.example.printconnector.infrastructure.cups.ipp;

import java.util.List;

/**
 * Decoded IPP response.
 *
 * @param statusCode IPP status code
 * @param requestId  id of the request this answers
 * @param groups     attribute groups in response order
 */
public record IppResponse(int statusCode, int requestId, List<IppAttributeGroup> groups) {

    public IppResponse {
        groups = List.copyOf(groups);
    }

    /**
     * @param groupTag delimiter tag, e.g. {@link IppTag#PRINTER_ATTRIBUTES}
     * @return all groups with that tag
     */
    public List<IppAttributeGroup> groups(int groupTag) {
        return groups.stream().filter(group -> group.groupTag() == groupTag).toList();
    }
}
