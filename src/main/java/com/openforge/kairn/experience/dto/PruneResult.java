package com.openforge.kairn.experience.dto;

import java.util.List;

public record PruneResult(
        int        pruned,
        double     threshold,
        List<Long> ids
) {}
