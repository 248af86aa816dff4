package org.netpreserve.crawlguard;

/**
 * Thrown when a session can't be set up, typically because its storage backend failed to open.
 */
public class CrawlGuardException extends RuntimeException {
    public CrawlGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
