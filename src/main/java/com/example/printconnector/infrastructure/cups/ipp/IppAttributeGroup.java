package com.example.printconnector.infrastructure.cups.ipp;

import java.util.List;
import java.util.Optional;

/**
 * Attributes sharing one delimiter tag, e.g. the attributes of one printer.
 */
public record IppAttributeGroup(int groupTag, List<IppAttribute> attributes) {

    public IppAttributeGroup {
        attributes = List.copyOf(attributes);
    }

    public Optional<IppAttribute> find(String name) {
        return attributes.stream().filter(attribute -> attribute.name().equals(name)).findFirst();
    }
}
