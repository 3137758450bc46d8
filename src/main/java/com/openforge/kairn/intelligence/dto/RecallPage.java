package com.openforge.kairn.intelligence.dto;

import java.util.List;

public record RecallPage(
        String           query,
        int              count,
        List<RecallItem> items
) {}
