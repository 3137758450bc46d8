package com.openforge.kairn.router.dto;

public record RebuildResult(
        int nodesIndexed,
        int keywords
) {}
