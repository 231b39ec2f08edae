package com.memlayout.generator.codegen.export;

import lombok.Builder;
import lombok.Value;

/**
 * Values shown in the comment banner at the top of an exported header.
 */
@Value
@Builder
public class BannerInfo {

    String toolName;

    /**
     * Project file the layout was loaded from.
     */
    String source;

    /**
     * Module base address of the layout, e.g. {@code "0x400000"}.
     */
    String baseAddress;

    /**
     * What was rendered, e.g. {@code "world > player (id=0x2, size=0x40)"} or {@code "Full SDK export"}.
     */
    String renderedFrom;
}
