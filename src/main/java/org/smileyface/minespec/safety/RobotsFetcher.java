package org.smileyface.minespec.safety;

import java.util.Optional;

/**
 * Retrieves robots.txt bodies for the safety gate.
 */
@FunctionalInterface
public interface RobotsFetcher {

    /**
     * @param robotsUrl absolute URL of the robots.txt file
     * @return the body, or empty when it could not be read (missing, error status, timeout)
     */
    Optional<String> fetch(String robotsUrl);
}
