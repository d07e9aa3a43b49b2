package com.marketpool.adapter.metaculus;

import com.marketpool.adapter.CoolDown;
import com.marketpool.adapter.SourceAdapter;
import com.marketpool.adapter.SourceSession;
import com.marketpool.domain.MarketFilter;
import com.marketpool.error.TransientFetchException;
import com.marketpool.infra.HttpSession;
import com.marketpool.infra.HttpSessionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Metaculus through its question API client: open binary questions with a
 * community prediction that resolve within a year.
 */
@Slf4j
@Component
public class MetaculusAdapter implements SourceAdapter<MetaculusMarket> {

    static final int DEFAULT_MIN_FORECASTERS = 40;

    private final HttpSessionFactory sessions;
    private final String apiToken;
    private final Function<HttpSession, MetaculusApi> clients;
    private final Clock clock;
    private final int maxPages;
    private final CoolDown pageCoolDown;

    @Autowired
    public MetaculusAdapter(HttpSessionFactory sessions, @Value("${marketpool.metaculus.api-token:}") String apiToken) {
        this(sessions, apiToken, MetaculusRestApi::new, Clock.systemUTC(), 50, CoolDown.ofMillis(100));
    }

    MetaculusAdapter(HttpSessionFactory sessions, String apiToken, Function<HttpSession, MetaculusApi> clients,
            Clock clock, int maxPages, CoolDown pageCoolDown) {
        this.sessions = sessions;
        this.apiToken = apiToken;
        this.clients = clients;
        this.clock = clock;
        this.maxPages = maxPages;
        this.pageCoolDown = pageCoolDown;
    }

    @Override
    public String platformName() {
        return MetaculusMarket.PLATFORM;
    }

    @Override
    public SourceSession<MetaculusMarket> openSession() {
        Map<String, String> headers = apiToken == null || apiToken.isBlank()
                ? Map.of()
                : Map.of("Authorization", "Token " + apiToken);
        HttpSession http = sessions.open(headers);
        MetaculusApi api;
        try {
            api = clients.apply(http);
        } catch (RuntimeException e) {
            http.close();
            throw e;
        }

        return new SourceSession<MetaculusMarket>() {
            @Override
            public List<MetaculusMarket> fetchMarkets(MarketFilter filter) {
                MetaculusQuery query = MetaculusQuery.builder()
                        .status(filter.isOnlyOpen() ? "open" : "open,closed,resolved")
                        .minForecasters(Math.max(filter.getMinForecasters(), DEFAULT_MIN_FORECASTERS))
                        .resolvesBefore(LocalDate.now(clock).plusYears(1))
                        .build();
                return fetchAll(api, query);
            }

            @Override
            public void close() {
                http.close();
            }
        };
    }

    /**
     * Offset paging until the API reports no more results. A failed later page ends the walk.
     */
    private List<MetaculusMarket> fetchAll(MetaculusApi api, MetaculusQuery query) {
        List<MetaculusMarket> questions = new ArrayList<>();
        for (int page = 0; page < maxPages; page++) {
            if (page > 0) {
                pageCoolDown.pause();
            }
            MetaculusApi.QuestionPage result;
            try {
                result = api.fetchQuestions(query, page * query.getPageSize());
            } catch (TransientFetchException e) {
                if (page == 0) {
                    throw e;
                }
                log.warn("[{}] Page {} unavailable, treating as end of data: {}", MetaculusMarket.PLATFORM,
                        page + 1, e.getMessage());
                break;
            }
            questions.addAll(result.getQuestions());
            if (!result.isHasMore()) {
                break;
            }
        }
        log.info("[{}] Collected {} questions", MetaculusMarket.PLATFORM, questions.size());
        return questions;
    }
}
