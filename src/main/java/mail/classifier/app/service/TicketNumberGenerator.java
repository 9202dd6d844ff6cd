package mail.classifier.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.classifier.app.config.MailClassifierProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Ticket numbers for customer requests: {@code <prefix><yyyyMMdd>-<last 6 alphanumerics of the id>}.
 * Same (received-at, external id) always gives the same ticket.
 */
@Slf4j
@Component
public class TicketNumberGenerator {
    private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final String prefix;
    private final Clock clock;

    public TicketNumberGenerator(MailClassifierProperties properties, Clock clock) {
        this.prefix = properties.getTicketPrefix() == null ? "" : properties.getTicketPrefix();
        this.clock = clock;
    }

    public String generate(String receivedAt, String externalId) {
        return prefix + dateComponent(receivedAt) + "-" + suffix(externalId);
    }

    /** yyyyMMdd of the timestamp, today (UTC) when missing or unparseable. */
    String dateComponent(String receivedAt) {
        LocalDate date;
        try {
            date = parseDate(receivedAt);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable received_at '{}', using today's date for ticket", receivedAt);
            date = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        }
        return date.format(BASIC_DATE);
    }

    static String suffix(String externalId) {
        StringBuilder alnum = new StringBuilder();
        if (externalId != null) {
            for (char ch : externalId.toCharArray()) {
                if (Character.isLetterOrDigit(ch)) {
                    alnum.append(ch);
                }
            }
        }
        String upper = alnum.toString().toUpperCase(Locale.ROOT);
        return upper.length() > 6 ? upper.substring(upper.length() - 6) : upper;
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new DateTimeParseException("empty timestamp", "", 0);
        }
        String trimmed = value.strip();
        if (trimmed.length() > 10 && trimmed.charAt(10) == ' ') {
            // ISO date-time with a space instead of 'T'
            trimmed = trimmed.substring(0, 10) + 'T' + trimmed.substring(11);
        }
        try {
            return OffsetDateTime.parse(trimmed).toLocalDate();
        } catch (DateTimeParseException e) {
            // timestamps without offset, or a bare date
            if (trimmed.length() > 10 && trimmed.charAt(10) == 'T') {
                return LocalDateTime.parse(trimmed).toLocalDate();
            }
            return LocalDate.parse(trimmed);
        }
    }
}
