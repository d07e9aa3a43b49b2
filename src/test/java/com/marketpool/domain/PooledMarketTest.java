package com.marketpool.domain;

import com.marketpool.error.MarketParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PooledMarketTest {

    private PooledMarket.PooledMarketBuilder base() {
        return PooledMarket.builder()
                .id(PooledMarket.platformId("manifold", "abc"))
                .question("Will it rain tomorrow?")
                .sourcePlatform("Manifold");
    }

    @Test
    void testFormattedOutcomesDerivedOnConstruction() {
        PooledMarket market = base().outcomes(List.of("Yes", "No")).outcomeProbabilities(List.of(0.7, 0.3)).build();

        assertEquals("manifold_abc", market.getId());
        assertEquals("Yes: 70.0%; No: 30.0%", market.getFormattedOutcomes());
    }

    @Test
    void testFormattedOutcomesRecomputedWhenOutcomesChange() {
        PooledMarket market = base().outcomes(List.of("Yes", "No")).outcomeProbabilities(List.of(0.7, 0.3)).build();

        PooledMarket changed = market.withOutcomes(List.of("A", "B", "C"), List.of(0.2, 0.3, 0.5));

        assertEquals("A: 20.0%; B: 30.0%; C: 50.0%", changed.getFormattedOutcomes());
        assertEquals("Yes: 70.0%; No: 30.0%", market.getFormattedOutcomes());
    }

    @Test
    void testMissingProbabilitiesAreAlignedAsUnknown() {
        PooledMarket market = base().outcomes(List.of("Yes", "No")).build();

        assertEquals(2, market.getOutcomeProbabilities().size());
        assertNull(market.getOutcomeProbabilities().get(0));
        assertEquals("Yes: N/A; No: N/A", market.getFormattedOutcomes());
    }

    @Test
    void testLengthMismatchIsRejected() {
        assertThrows(MarketParseException.class,
                () -> base().outcomes(List.of("Yes", "No")).outcomeProbabilities(List.of(0.5)).build());
    }

    @Test
    void testRequiredFields() {
        assertThrows(MarketParseException.class, () -> base().question(" ").build());
        assertThrows(MarketParseException.class, () -> base().id(null).build());
        assertThrows(MarketParseException.class, () -> base().sourcePlatform("").build());
    }

    @Test
    void testRawDataExcludedFromEquality() {
        PooledMarket withRaw = base().rawMarketData(new Object()).build();
        PooledMarket withoutRaw = base().build();

        assertEquals(withoutRaw, withRaw);
        assertNull(withRaw.withoutRawData().getRawMarketData());
    }
}
