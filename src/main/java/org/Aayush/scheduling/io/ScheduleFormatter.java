package org.Aayush.scheduling.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.Aayush.scheduling.core.ScheduleResponse;
import org.Aayush.scheduling.interval.Interval;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders schedule responses as interval text lines or JSON.
 */
public final class ScheduleFormatter {
    private final ObjectMapper objectMapper;

    public ScheduleFormatter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Renders chosen intervals one per line in the input format.
     */
    public List<String> toLines(ScheduleResponse response) {
        List<String> lines = new ArrayList<>(response.size());
        for (Interval interval : response.getIntervals()) {
            lines.add(formatInterval(interval));
        }
        return lines;
    }

    /**
     * Returns a one-line summary such as {@code Total cost is 4, using 2 intervals.}
     */
    public String statusLine(ScheduleResponse response) {
        int count = response.size();
        return "Total cost is " + formatNumber(response.getTotalCost())
                + ", using " + count + (count == 1 ? " interval." : " intervals.");
    }

    /**
     * Serializes the response, including graph diagnostics.
     *
     * @throws JsonProcessingException when serialization fails.
     */
    public String toJson(ScheduleResponse response) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode intervals = root.putArray("intervals");
        for (Interval interval : response.getIntervals()) {
            intervals.addObject()
                    .put("start", interval.getStart())
                    .put("finish", interval.getFinish())
                    .put("weight", interval.getWeight());
        }
        root.put("totalCost", response.getTotalCost());
        root.put("intervalCount", response.getIntervalCount());
        root.put("edgeCount", response.getEdgeCount());
        root.put("rootCount", response.getRootCount());
        return objectMapper.writeValueAsString(root);
    }

    /**
     * Formats one interval as {@code start finish weight}.
     */
    public static String formatInterval(Interval interval) {
        return formatNumber(interval.getStart()) + " "
                + formatNumber(interval.getFinish()) + " "
                + formatNumber(interval.getWeight());
    }

    /**
     * Shortest plain decimal form: {@code 10.0 -> "10"}, {@code 1.1 -> "1.1"}.
     */
    public static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
