package ch.so.arp.courserag.session;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the most recent exchanges of each conversation in memory so they can be
 * included in later prompts. Older exchanges are evicted first once the bound
 * is reached. Sessions live as long as the store.
 */
public class SessionStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionStore.class);

    private final int maxHistory;
    private final Map<String, Deque<Exchange>> sessions = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param maxHistory number of exchanges kept per session
     */
    public SessionStore(int maxHistory) {
        if (maxHistory <= 0) {
            throw new IllegalArgumentException("maxHistory must be positive");
        }
        this.maxHistory = maxHistory;
    }

    public String create() {
        String sessionId = "session_" + sequence.incrementAndGet();
        sessions.put(sessionId, new ArrayDeque<>());
        LOGGER.debug("Created {}", sessionId);
        return sessionId;
    }

    /**
     * Record an exchange, creating the session if it does not exist yet.
     */
    public void append(String sessionId, String query, String answer) {
        Deque<Exchange> exchanges = sessions.computeIfAbsent(sessionId, id -> new ArrayDeque<>());
        exchanges.addLast(new Exchange(query, answer));
        while (exchanges.size() > maxHistory) {
            exchanges.removeFirst();
        }
    }

    /**
     * Exchanges of a session, oldest first. Empty for unknown sessions.
     */
    public List<Exchange> history(String sessionId) {
        Deque<Exchange> exchanges = sessions.get(sessionId);
        return exchanges == null ? List.of() : List.copyOf(exchanges);
    }

    /**
     * Render the history as alternating {@code User:} and {@code Assistant:}
     * lines, or an empty string if there is none.
     */
    public String render(String sessionId) {
        StringBuilder text = new StringBuilder();
        for (Exchange exchange : history(sessionId)) {
            if (!text.isEmpty()) {
                text.append('\n');
            }
            text.append("User: ").append(exchange.query())
                    .append('\n')
                    .append("Assistant: ").append(exchange.answer());
        }
        return text.toString();
    }

    public void clear(String sessionId) {
        Deque<Exchange> exchanges = sessions.get(sessionId);
        if (exchanges != null) {
            exchanges.clear();
        }
    }
}
