package com.equitiesai.providers;

import com.equitiesai.models.ModelDescriptor;
import com.equitiesai.models.TokenUsage;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running token totals for cost monitoring. Daily and monthly counters reset when the
 * UTC date rolls over. Only counts that a provider actually reported are added.
 */
public class UsageTracker {

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final double PER_MILLION = 1_000_000d;

    private final Clock clock;
    private final Map<String, ProviderUsage> byProvider = new LinkedHashMap<>();
    private String today = "";
    private String month = "";
    private long dailyTokens;
    private long monthlyTokens;

    public UsageTracker() {
        this(Clock.systemUTC());
    }

    public UsageTracker(Clock clock) {
        this.clock = clock;
    }

    public synchronized void record(String providerId, ModelDescriptor model, TokenUsage usage) {
        if (usage == null) {
            return;
        }
        rollOver();
        long input = usage.getInputTokens() != null ? usage.getInputTokens() : 0;
        long output = usage.getOutputTokens() != null ? usage.getOutputTokens() : 0;
        long reasoning = usage.getReasoningTokens() != null ? usage.getReasoningTokens() : 0;

        dailyTokens += input + output;
        monthlyTokens += input + output;

        ProviderUsage totals = byProvider.computeIfAbsent(providerId, id -> new ProviderUsage());
        totals.requests++;
        totals.inputTokens += input;
        totals.outputTokens += output;
        totals.reasoningTokens += reasoning;
        if (model != null) {
            if (model.getInputPrice() != null) {
                totals.estimatedCost += input * model.getInputPrice() / PER_MILLION;
            }
            if (model.getOutputPrice() != null) {
                totals.estimatedCost += output * model.getOutputPrice() / PER_MILLION;
            }
        }
    }

    public synchronized long getDailyUsage() {
        rollOver();
        return dailyTokens;
    }

    public synchronized long getMonthlyUsage() {
        rollOver();
        return monthlyTokens;
    }

    public synchronized Snapshot snapshot() {
        rollOver();
        Map<String, ProviderUsage> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ProviderUsage> entry : byProvider.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().copy());
        }
        return new Snapshot(today, dailyTokens, month, monthlyTokens, copy);
    }

    private void rollOver() {
        LocalDate date = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        String currentDay = date.toString();
        String currentMonth = date.format(MONTH_FORMAT);
        if (!currentDay.equals(today)) {
            today = currentDay;
            dailyTokens = 0;
        }
        if (!currentMonth.equals(month)) {
            month = currentMonth;
            monthlyTokens = 0;
        }
    }

    public static class ProviderUsage {
        private long requests;
        private long inputTokens;
        private long outputTokens;
        private long reasoningTokens;
        private double estimatedCost;

        public long getRequests() {
            return requests;
        }

        public long getInputTokens() {
            return inputTokens;
        }

        public long getOutputTokens() {
            return outputTokens;
        }

        public long getReasoningTokens() {
            return reasoningTokens;
        }

        /** US dollars, from catalog prices per million tokens. */
        public double getEstimatedCost() {
            return estimatedCost;
        }

        ProviderUsage copy() {
            ProviderUsage copy = new ProviderUsage();
            copy.requests = requests;
            copy.inputTokens = inputTokens;
            copy.outputTokens = outputTokens;
            copy.reasoningTokens = reasoningTokens;
            copy.estimatedCost = estimatedCost;
            return copy;
        }
    }

    public static class Snapshot {
        private final String date;
        private final long dailyTokens;
        private final String month;
        private final long monthlyTokens;
        private final Map<String, ProviderUsage> providers;

        Snapshot(String date, long dailyTokens, String month, long monthlyTokens,
                 Map<String, ProviderUsage> providers) {
            this.date = date;
            this.dailyTokens = dailyTokens;
            this.month = month;
            this.monthlyTokens = monthlyTokens;
            this.providers = providers;
        }

        public String getDate() {
            return date;
        }

        public long getDailyTokens() {
            return dailyTokens;
        }

        public String getMonth() {
            return month;
        }

        public long getMonthlyTokens() {
            return monthlyTokens;
        }

        public Map<String, ProviderUsage> getProviders() {
            return providers;
        }
    }
}
