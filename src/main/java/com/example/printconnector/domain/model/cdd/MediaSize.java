package com.example.printconnector.domain.model.cdd;

import java.util.List;

/**
 * Media size capability.
 *
 * @param option supported sizes, exactly one of them default
 */
public record MediaSize(List<MediaSizeOption> option) {

    public MediaSize {
        option = SingleDefault.require("media_size", option, MediaSizeOption::isDefault);
    }
}
