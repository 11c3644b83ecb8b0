package com.xinyue.router.web.controller;

import com.xinyue.router.common.Exchange;
import com.xinyue.router.infra.MetricsService;
import com.xinyue.router.io.MarketDataConnector;
import com.xinyue.router.web.context.AppContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import org.noear.solon.annotation.Controller;
import org.noear.solon.annotation.Get;
import org.noear.solon.annotation.Inject;
import org.noear.solon.annotation.Mapping;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 健康检查控制器。
 */
@Controller
public class HealthController {

    @Inject
    private AppContext appContext;

    public HealthController() {
    }

    HealthController(AppContext appContext) {
        this.appContext = appContext;
    }

    /**
     * 健康检查接口：各交易所连接状态和计数器。
     * GET /health
     */
    @Get
    @Mapping("/health")
    public Map<String, Object> health() {
        MetricsService metrics = appContext.getMetricsService();

        Map<String, Object> feeds = new HashMap<>();
        for (MarketDataConnector connector : appContext.getAccessLayerCoordinator().connectors()) {
            Exchange exchange = connector.exchange();
            Map<String, Object> feed = new HashMap<>();
            feed.put("connected", connector.isConnected());
            feed.put("malformed", metrics.malformedCount(exchange));
            feed.put("reconnects", metrics.reconnectCount(exchange));
            feeds.put(exchange.wireName(), feed);
        }

        Map<String, Object> counters = new HashMap<>();
        counters.put("ticks", metrics.ticks());
        counters.put("orders", metrics.orders());
        counters.put("fills", metrics.fills());
        counters.put("ignoredTrades", metrics.ignoredTrades());
        counters.put("lateKlineTrades", metrics.lateKlineTrades());
        counters.put("malformedClientFrames", metrics.malformedClientFrames());
        counters.put("droppedOutbound", metrics.droppedOutbound());
        counters.put("clients", appContext.getHub().sessionCount());

        Map<String, Object> result = new HashMap<>();
        result.put("status", "UP");
        result.put("timestamp", System.currentTimeMillis());
        result.put("feeds", feeds);
        result.put("counters", counters);
        result.put("meters", meters(metrics));
        return result;
    }

    /**
     * registry 里的全部计数器，键为 name{tag=value,...}。
     */
    private static Map<String, Object> meters(MetricsService metrics) {
        Map<String, Object> meters = new TreeMap<>();
        for (Meter meter : metrics.registry().getMeters()) {
            if (meter instanceof Counter && meter.getId().getName().startsWith("router.")) {
                meters.put(meterKey(meter), (long) ((Counter) meter).count());
            }
        }
        return meters;
    }

    private static String meterKey(Meter meter) {
        StringBuilder sb = new StringBuilder(meter.getId().getName());
        StringBuilder tags = new StringBuilder();
        for (Tag tag : meter.getId().getTags()) {
            if ("service".equals(tag.getKey())) {
                continue;
            }
            if (tags.length() > 0) {
                tags.append(',');
            }
            tags.append(tag.getKey()).append('=').append(tag.getValue());
        }
        if (tags.length() > 0) {
            sb.append('{').append(tags).append('}');
        }
        return sb.toString();
    }
}
