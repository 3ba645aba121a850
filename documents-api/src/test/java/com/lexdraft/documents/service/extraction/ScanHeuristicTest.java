package com.lexdraft.documents.service.extraction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScanHeuristicTest {

    @Test
    void fewCharactersPerPageLooksScanned() {
        assertThat(ScanHeuristic.isLikelyScanned(3, 150)).isTrue();
    }

    @Test
    void plentyOfCharactersPerPageLooksLikeText() {
        assertThat(ScanHeuristic.isLikelyScanned(3, 600)).isFalse();
    }

    @Test
    void thresholdIsStrict() {
        assertThat(ScanHeuristic.isLikelyScanned(2, 199)).isTrue();
        assertThat(ScanHeuristic.isLikelyScanned(2, 200)).isFalse();
    }

    @Test
    void documentWithoutPagesCountsAsScanned() {
        assertThat(ScanHeuristic.isLikelyScanned(0, 0)).isTrue();
    }

    @Test
    void parseFailurePolicyAssumesScanned() {
        assertThat(ScanHeuristic.PARSE_FAILURE_ASSUMES_SCANNED).isTrue();
    }
}
