package com.marketpool.adapter.predictit;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpool.adapter.PlatformMarket;
import com.marketpool.domain.FlexibleTimestampParser;
import com.marketpool.domain.PooledMarket;
import com.marketpool.error.MarketParseException;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class PredictItMarket implements PlatformMarket {

    static final String PLATFORM = "PredictIt";

    String id;
    String name;
    String url;
    List<Contract> contracts;
    String timeStamp;
    String status;

    @Value
    public static class Contract {
        long id;
        String name;
        Double lastTradePrice;
        Double bestBuyYesCost;
        Double bestSellYesCost;

        static Contract fromJson(JsonNode node) {
            return new Contract(node.path("id").asLong(), node.path("name").asText(""),
                    number(node.path("lastTradePrice")), number(node.path("bestBuyYesCost")),
                    number(node.path("bestSellYesCost")));
        }

        private static Double number(JsonNode node) {
            return node.isNumber() ? node.asDouble() : null;
        }
    }

    static PredictItMarket fromJson(JsonNode node) {
        if (!node.hasNonNull("id")) {
            throw new MarketParseException("PredictIt market without id");
        }
        List<Contract> contracts = new ArrayList<>();
        for (JsonNode contract : node.path("contracts")) {
            contracts.add(Contract.fromJson(contract));
        }
        return PredictItMarket.builder()
                .id(node.path("id").asText())
                .name(node.path("name").asText(null))
                .url(node.path("url").asText(null))
                .contracts(contracts)
                .timeStamp(node.path("timeStamp").asText(null))
                .status(node.path("status").asText(null))
                .build();
    }

    public boolean isClosed() {
        return status != null && status.equalsIgnoreCase("closed");
    }

    /**
     * A single contract is a yes/no statement; several contracts are the
     * outcomes of one question.
     */
    List<String> outcomes() {
        if (contracts.size() == 1) {
            return List.of("Yes", "No");
        }
        List<String> names = new ArrayList<>(contracts.size());
        contracts.forEach(c -> names.add(c.getName()));
        return names;
    }

    /**
     * Last trade prices as probabilities; multi-contract prices are normalized to sum to one.
     */
    List<Double> outcomeProbabilities() {
        List<Double> out = new ArrayList<>();
        if (contracts.size() == 1) {
            Double yes = contracts.get(0).getLastTradePrice();
            out.add(yes);
            out.add(yes == null ? null : (yes <= 1 ? 1.0 - yes : 0.0));
            return out;
        }
        double total = 0;
        for (Contract contract : contracts) {
            if (contract.getLastTradePrice() != null) {
                total += contract.getLastTradePrice();
            }
        }
        for (Contract contract : contracts) {
            Double price = contract.getLastTradePrice();
            if (price == null) {
                out.add(null);
            } else {
                out.add(total > 0 ? price / total : 0.0);
            }
        }
        return out;
    }

    String marketType() {
        if (contracts.size() == 1) {
            return "BINARY";
        }
        return contracts.isEmpty() ? "UNKNOWN" : "CATEGORICAL";
    }

    @Override
    public PooledMarket toPooledMarket() {
        return PooledMarket.builder()
                .id(PooledMarket.platformId("predictit", id))
                .question(name)
                .outcomes(outcomes())
                .outcomeProbabilities(outcomeProbabilities())
                .url(url)
                .publishedAt(FlexibleTimestampParser.parse(timeStamp))
                .sourcePlatform(PLATFORM)
                .marketType(marketType())
                .resolved(isClosed())
                .rawMarketData(this)
                .build();
    }
}
