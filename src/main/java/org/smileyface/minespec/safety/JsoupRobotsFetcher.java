package org.smileyface.minespec.safety;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link RobotsFetcher} using jsoup. Redirects are not followed; a robots.txt behind a redirect is
 * treated as unreadable.
 */
public class JsoupRobotsFetcher implements RobotsFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupRobotsFetcher.class);
    private static final int MAX_ROBOTS_BYTES = 512 * 1024;

    private final String userAgent;
    private final int timeoutMs;

    public JsoupRobotsFetcher(String userAgent, int timeoutMs) {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.timeoutMs = Math.max(0, timeoutMs);
    }

    @Override
    public Optional<String> fetch(String robotsUrl) {
        try {
            Connection.Response res = Jsoup.connect(robotsUrl)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(false)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .maxBodySize(MAX_ROBOTS_BYTES)
                    .execute();
            if (res.statusCode() != 200) {
                log.debug("robots.txt {} returned HTTP {}", robotsUrl, res.statusCode());
                return Optional.empty();
            }
            return Optional.of(res.body());
        } catch (Exception e) {
            log.debug("robots.txt {} unreadable: {}", robotsUrl, e.toString());
            return Optional.empty();
        }
    }
}
