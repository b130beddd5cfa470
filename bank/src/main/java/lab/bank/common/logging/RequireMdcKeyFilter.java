package lab.bank.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.Map;

// Passes only events carrying the configured MDC key.
public class RequireMdcKeyFilter extends Filter<ILoggingEvent> {

    private String key = "correlationId";

    public void setKey(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && mdc.containsKey(key)) {
            return FilterReply.NEUTRAL;
        }
        return FilterReply.DENY;
    }
}
