package com.marketpool.adapter.gjopen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpool.adapter.CoolDown;
import com.marketpool.adapter.DetailFetcher;
import com.marketpool.adapter.HttpSourceSession;
import com.marketpool.adapter.PageWalker;
import com.marketpool.adapter.SourceAdapter;
import com.marketpool.adapter.SourceSession;
import com.marketpool.domain.MarketFilter;
import com.marketpool.error.AdapterAuthException;
import com.marketpool.error.ConfigurationException;
import com.marketpool.error.MarketParseException;
import com.marketpool.infra.HttpPage;
import com.marketpool.infra.HttpSession;
import com.marketpool.infra.HttpSessionFactory;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Good Judgment Open. Needs a logged-in session; listing pages are HTML sorted
 * by predictor count, each question's data sits in the react props of its page.
 */
@Slf4j
@Component
public class GJOpenAdapter implements SourceAdapter<GJOpenMarket> {

    static final String BASE_URL = "https://www.gjopen.com";
    static final String SIGN_IN_URL = BASE_URL + "/users/sign_in";
    static final int DEFAULT_MIN_FORECASTERS = 40;

    private static final Pattern QUESTION_PATH = Pattern.compile("/questions/(\\d+)");
    private static final String POOL_INTERFACE =
            "div[data-react-class=\"FOF.Forecast.PredictionInterfaces.OpinionPoolInterface\"]";

    private final HttpSessionFactory sessions;
    private final ObjectMapper objectMapper;
    private final String email;
    private final String password;
    private final int maxPages;
    private final CoolDown pageCoolDown;
    private final CoolDown itemCoolDown;

    @Autowired
    public GJOpenAdapter(HttpSessionFactory sessions, ObjectMapper objectMapper,
            @Value("${marketpool.gjopen.email:}") String email,
            @Value("${marketpool.gjopen.password:}") String password) {
        this(sessions, objectMapper, email, password, 20, CoolDown.ofMillis(600), CoolDown.ofMillis(700));
    }

    GJOpenAdapter(HttpSessionFactory sessions, ObjectMapper objectMapper, String email, String password,
            int maxPages, CoolDown pageCoolDown, CoolDown itemCoolDown) {
        this.sessions = sessions;
        this.objectMapper = objectMapper;
        this.email = email;
        this.password = password;
        this.maxPages = maxPages;
        this.pageCoolDown = pageCoolDown;
        this.itemCoolDown = itemCoolDown;
    }

    @Override
    public String platformName() {
        return GJOpenMarket.PLATFORM;
    }

    @Override
    public SourceSession<GJOpenMarket> openSession() {
        if (email == null || email.isBlank() || password == null || password.isBlank()) {
            throw ConfigurationException.missing("GJOpen credentials", "GJO_EMAIL and GJO_PASSWORD");
        }
        HttpSession http = sessions.open();
        try {
            login(http);
        } catch (RuntimeException e) {
            http.close();
            throw e;
        }
        return new Session(http);
    }

    private void login(HttpSession http) {
        HttpPage signIn = http.getPage(SIGN_IN_URL);
        Element token = Jsoup.parse(signIn.getBody(), signIn.getUrl()).selectFirst("meta[name=csrf-token]");
        if (token == null || token.attr("content").isEmpty()) {
            throw new AdapterAuthException("GJOpen sign-in page carries no CSRF token");
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("user[email]", email);
        form.put("user[password]", password);
        form.put("authenticity_token", token.attr("content"));
        HttpPage response = http.postForm(SIGN_IN_URL, form);

        if (response.getBody().contains("Invalid Email or password") || response.getUrl().contains("sign_in")) {
            throw new AdapterAuthException("GJOpen rejected the login");
        }
        log.info("[{}] Logged in", GJOpenMarket.PLATFORM);
    }

    static String listingUrl(int page) {
        return BASE_URL + "/questions?sort=predictors_count&sort_dir=desc&page=" + page;
    }

    private class Session extends HttpSourceSession<GJOpenMarket> {

        Session(HttpSession http) {
            super(http);
        }

        @Override
        public List<GJOpenMarket> fetchMarkets(MarketFilter filter) {
            int floor = Math.max(filter.getMinForecasters(), DEFAULT_MIN_FORECASTERS);
            Set<String> requested = new HashSet<>();

            List<GJOpenMarket> markets = PageWalker.<GJOpenMarket>builder()
                    .platform(GJOpenMarket.PLATFORM)
                    .maxPages(maxPages)
                    .pageCoolDown(pageCoolDown)
                    .identity(GJOpenMarket::getId)
                    .belowFloor(m -> m.getPredictorsCount() < floor)
                    .build()
                    .walk((page, previous) -> {
                        List<String> ids = questionIds(http.getText(listingUrl(page)));
                        ids.removeIf(id -> !requested.add(id));
                        return DetailFetcher.fetchEach(GJOpenMarket.PLATFORM, ids, this::fetchQuestion, itemCoolDown);
                    });

            return markets.stream()
                    .filter(m -> m.getPredictorsCount() >= floor)
                    .filter(m -> m.getCommentsCount() >= filter.getMinComments())
                    .collect(Collectors.toList());
        }

        private GJOpenMarket fetchQuestion(String id) {
            String url = BASE_URL + "/questions/" + id;
            Document doc = Jsoup.parse(http.getText(url), url);
            Element pool = doc.selectFirst(POOL_INTERFACE);
            if (pool == null) {
                throw new MarketParseException("No forecast data on " + url);
            }
            JsonNode props;
            try {
                props = objectMapper.readTree(pool.attr("data-react-props"));
            } catch (IOException e) {
                throw new MarketParseException("Unreadable forecast data on " + url, e);
            }
            return GJOpenMarket.fromJson(props.path("question"), url);
        }
    }

    /**
     * Question ids linked from a listing page, in page order.
     */
    static List<String> questionIds(String html) {
        Set<String> ids = new LinkedHashSet<>();
        for (Element link : Jsoup.parse(html, BASE_URL).select("a[href]")) {
            Matcher matcher = QUESTION_PATH.matcher(link.attr("href"));
            if (matcher.find()) {
                ids.add(matcher.group(1));
            }
        }
        return new ArrayList<>(ids);
    }
}
