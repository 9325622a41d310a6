package com.signalrelay.notification;

import com.signalrelay.domain.model.SignalEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders a {@link SignalEvent} as a Telegram message in HTML parse mode.
 *
 * <pre>
 * &lt;b&gt;BTCUSDT&lt;/b&gt;  (1h)
 * Signal: &lt;i&gt;Buy&lt;/i&gt;  Price: 45000
 * 🕒 2025-08-05T18:30:00Z
 * 📈 &lt;a href='https://...'&gt;Chart&lt;/a&gt;
 * </pre>
 *
 * <p>The interval suffix and the chart line only appear when the alert carried them.
 * Every sender-supplied value is HTML-escaped; Telegram rejects the whole message on an
 * unbalanced tag.
 */
@Component
public class SignalMessageRenderer {

    private static final String CLOCK_EMOJI = "🕒";
    private static final String CHART_EMOJI = "📈";

    public String render(SignalEvent event) {
        StringBuilder text = new StringBuilder();
        text.append("<b>").append(escape(event.getTicker())).append("</b>");
        if (event.getInterval() != null) {
            text.append("  (").append(escape(event.getInterval())).append(')');
        }
        text.append('\n')
                .append("Signal: <i>")
                .append(event.getSignal().getLabel())
                .append("</i>  Price: ")
                .append(event.getPrice().toPlainString())
                .append('\n')
                .append(CLOCK_EMOJI)
                .append(' ')
                .append(escape(event.getTime()));
        if (event.getChart() != null) {
            text.append('\n')
                    .append(CHART_EMOJI)
                    .append(" <a href='")
                    .append(escape(event.getChart()))
                    .append("'>Chart</a>");
        }
        return text.toString();
    }

    // UTF-8 keeps non-ASCII text as-is; Telegram only understands the basic named entities
    private String escape(String value) {
        return HtmlUtils.htmlEscape(value, "UTF-8");
    }
}
