package com.example.printconnector.infrastructure.cups.ipp;

import java.util.ArrayList;
import java.util.List;

/**
 * IPP request consisting of an operation and its operation attributes.
 *
 * @param operationId         operation to perform
 * @param requestId           id echoed back in the response
 * @param operationAttributes attributes written into the operation group, in order
 */
public record IppRequest(int operationId, int requestId, List<IppAttribute> operationAttributes) {

    public IppRequest {
        operationAttributes = List.copyOf(operationAttributes);
    }

    /**
     * Builds a request whose operation group starts with the mandatory charset and language attributes.
     *
     * @param operationId operation to perform
     * @param requestId   id echoed back in the response
     * @param attributes  further operation attributes
     * @return request ready to encode
     */
    public static IppRequest of(int operationId, int requestId, IppAttribute... attributes) {
        List<IppAttribute> operationAttributes = new ArrayList<>();
        operationAttributes.add(IppAttribute.charset("utf-8"));
        operationAttributes.add(IppAttribute.naturalLanguage("en-us"));
        operationAttributes.addAll(List.of(attributes));
        return new IppRequest(operationId, requestId, operationAttributes);
    }
}
