package com.williamcallahan.llmorchestrator.service.cost;

import com.williamcallahan.llmorchestrator.service.telemetry.MetricNames;
import com.williamcallahan.llmorchestrator.service.telemetry.MetricsSink;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks spend per provider against daily and monthly limits using pessimistic reservations.
 *
 * <p>{@link #reserve} adds the estimate to both windows before the provider is called, so
 * concurrent requests can never jointly overspend. {@link #commit} adjusts the reservation to
 * the actual cost and {@link #release} refunds it entirely. Counters are updated with
 * compare-and-swap only; no lock is held across a provider call.</p>
 *
 * <p>Windows roll over when the calendar day or month changes in the configured zone. The
 * scheduled {@link #rollover()} performs the swap eagerly, and every reservation checks the
 * period key lazily so a missed schedule never lets spend leak across periods.</p>
 */
public class CostLedger {
    private static final Logger log = LoggerFactory.getLogger(CostLedger.class);

    private final Map<String, ProviderBudgets> budgetsByProvider;
    private final Clock clock;
    private final ZoneId zoneId;
    private final double warningRatio;
    private final MetricsSink metricsSink;
    private final Set<String> warnedWindows = ConcurrentHashMap.newKeySet();
    private final AtomicLong unbilledOverrunCents = new AtomicLong();

    /**
     * Creates a ledger for the given provider limits.
     *
     * @param limitsByProvider spend limits keyed by provider name
     * @param clock time source used for period keys
     * @param zoneId zone in which days and months are counted
     * @param warningRatio utilization at which a one-time warning fires, in (0, 1]
     * @param metricsSink receiver for budget metrics
     */
    public CostLedger(
            Map<String, BudgetLimits> limitsByProvider,
            Clock clock,
            ZoneId zoneId,
            double warningRatio,
            MetricsSink metricsSink) {
        Objects.requireNonNull(limitsByProvider, "limitsByProvider");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
        this.metricsSink = Objects.requireNonNull(metricsSink, "metricsSink");
        if (warningRatio <= 0 || warningRatio > 1) {
            throw new IllegalArgumentException("warningRatio must be in (0, 1]");
        }
        this.warningRatio = warningRatio;
        LocalDate today = today();
        Map<String, ProviderBudgets> budgets = new ConcurrentHashMap<>();
        limitsByProvider.forEach((provider, limits) -> budgets.put(provider, new ProviderBudgets(provider, limits, today)));
        this.budgetsByProvider = budgets;
    }

    /**
     * Reserves {@code estimatedCents} against both the daily and the monthly window.
     *
     * @param provider provider to charge
     * @param estimatedCents pessimistic cost estimate
     * @return a reservation token, or the tightest window that refused
     */
    public ReservationResult reserve(String provider, long estimatedCents) {
        if (estimatedCents < 0) {
            throw new IllegalArgumentException("estimatedCents cannot be negative");
        }
        ProviderBudgets budgets = budgetsFor(provider);
        LocalDate today = today();
        Budget daily = budgets.current(BudgetPeriod.DAY, today);
        Budget monthly = budgets.current(BudgetPeriod.MONTH, today);

        if (!daily.tryReserve(estimatedCents)) {
            return rejection(provider, estimatedCents, daily, monthly);
        }
        if (!monthly.tryReserve(estimatedCents)) {
            daily.refund(estimatedCents);
            return rejection(provider, estimatedCents, daily, monthly);
        }
        afterMutation(daily);
        afterMutation(monthly);
        return new ReservationResult.Reserved(new ReservationToken(provider, estimatedCents, daily, monthly));
    }

    /**
     * Settles a reservation at the actual cost.
     *
     * <p>When the actual cost is below the estimate the difference is refunded. When it is above,
     * at most the remaining headroom is added so the limit is never crossed; the remainder is
     * recorded as an unbilled overrun. Settling a token twice has no effect.</p>
     *
     * @param token reservation to settle
     * @param actualCents cost reported for the call
     * @return cents charged for the call, or zero when the token was already settled
     */
    public long commit(ReservationToken token, long actualCents) {
        Objects.requireNonNull(token, "token");
        if (actualCents < 0) {
            throw new IllegalArgumentException("actualCents cannot be negative");
        }
        if (!token.markSettled()) {
            log.warn("Ignoring commit of already settled reservation (provider={})", token.provider());
            return 0L;
        }
        Budget daily = token.dailyBudget();
        Budget monthly = token.monthlyBudget();
        long delta = actualCents - token.estimatedCents();
        long charged = actualCents;
        if (delta < 0) {
            daily.refund(-delta);
            monthly.refund(-delta);
        } else if (delta > 0) {
            long grantedDaily = daily.reserveUpTo(delta);
            long grantedBoth = monthly.reserveUpTo(grantedDaily);
            if (grantedBoth < grantedDaily) {
                daily.refund(grantedDaily - grantedBoth);
            }
            long overrun = delta - grantedBoth;
            if (overrun > 0) {
                charged = actualCents - overrun;
                unbilledOverrunCents.addAndGet(overrun);
                log.warn(
                        "Actual cost exceeded estimate beyond remaining budget (provider={}, estimate={}, actual={}, unbilled={})",
                        token.provider(),
                        token.estimatedCents(),
                        actualCents,
                        overrun);
                metricsSink.emit(MetricNames.BUDGET_OVERRUN, overrun, Map.of(MetricNames.TAG_PROVIDER, token.provider()));
            }
        }
        afterMutation(daily);
        afterMutation(monthly);
        return charged;
    }

    /**
     * Refunds a reservation in full. Releasing a settled token has no effect.
     *
     * @param token reservation to release
     */
    public void release(ReservationToken token) {
        Objects.requireNonNull(token, "token");
        if (!token.markSettled()) {
            return;
        }
        token.dailyBudget().refund(token.estimatedCents());
        token.monthlyBudget().refund(token.estimatedCents());
        afterMutation(token.dailyBudget());
        afterMutation(token.monthlyBudget());
    }

    /**
     * Returns the smaller of the daily and monthly headroom for a provider.
     */
    public long remainingCents(String provider) {
        ProviderBudgets budgets = budgetsFor(provider);
        LocalDate today = today();
        return Math.min(
                budgets.current(BudgetPeriod.DAY, today).remainingCents(),
                budgets.current(BudgetPeriod.MONTH, today).remainingCents());
    }

    /**
     * Returns the fraction of the tighter window still available, in [0, 1].
     */
    public double headroomRatio(String provider) {
        ProviderBudgets budgets = budgetsFor(provider);
        LocalDate today = today();
        double dailyRatio = ratioRemaining(budgets.current(BudgetPeriod.DAY, today));
        double monthlyRatio = ratioRemaining(budgets.current(BudgetPeriod.MONTH, today));
        return Math.min(dailyRatio, monthlyRatio);
    }

    /** Returns whether limits are configured for the provider. */
    public boolean tracks(String provider) {
        return budgetsByProvider.containsKey(provider);
    }

    /**
     * Returns snapshots of both windows for one provider.
     */
    public List<BudgetSnapshot> snapshot(String provider) {
        ProviderBudgets budgets = budgetsFor(provider);
        LocalDate today = today();
        return List.of(
                BudgetSnapshot.of(budgets.current(BudgetPeriod.DAY, today)),
                BudgetSnapshot.of(budgets.current(BudgetPeriod.MONTH, today)));
    }

    /**
     * Returns snapshots of every tracked window, ordered by provider name.
     */
    public List<BudgetSnapshot> snapshots() {
        List<BudgetSnapshot> snapshots = new ArrayList<>();
        budgetsByProvider.keySet().stream().sorted().forEach(provider -> snapshots.addAll(snapshot(provider)));
        return List.copyOf(snapshots);
    }

    /**
     * Starts fresh windows for every provider whose day or month has ended.
     *
     * @return number of windows replaced
     */
    public int rollover() {
        LocalDate today = today();
        int rolled = 0;
        for (ProviderBudgets budgets : budgetsByProvider.values()) {
            rolled += budgets.rollIfStale(BudgetPeriod.DAY, today) ? 1 : 0;
            rolled += budgets.rollIfStale(BudgetPeriod.MONTH, today) ? 1 : 0;
        }
        if (rolled > 0) {
            log.info("Budget rollover started {} new window(s)", rolled);
        }
        return rolled;
    }

    /** Total cents charged above estimates that could not be billed within limits. */
    public long unbilledOverrunCents() {
        return unbilledOverrunCents.get();
    }

    private ReservationResult rejection(String provider, long requestedCents, Budget daily, Budget monthly) {
        boolean dailyRefuses = requestedCents > daily.remainingCents();
        boolean monthlyRefuses = requestedCents > monthly.remainingCents();
        Budget tightest;
        if (dailyRefuses && monthlyRefuses) {
            tightest = monthly.remainingCents() < daily.remainingCents() ? monthly : daily;
        } else {
            tightest = monthlyRefuses ? monthly : daily;
        }
        log.debug(
                "Budget reservation refused (provider={}, period={}, requested={}, remaining={})",
                provider,
                tightest.period(),
                requestedCents,
                tightest.remainingCents());
        return new ReservationResult.Rejected(
                provider, tightest.period(), tightest.limitCents(), tightest.spentCents(), requestedCents);
    }

    private void afterMutation(Budget budget) {
        Map<String, String> tags = Map.of(
                MetricNames.TAG_PROVIDER, budget.provider(),
                MetricNames.TAG_PERIOD, budget.period().name().toLowerCase(Locale.ROOT));
        metricsSink.emit(MetricNames.BUDGET_REMAINING, budget.remainingCents(), tags);
        if (budget.limitCents() == 0 || (double) budget.spentCents() / budget.limitCents() < warningRatio) {
            return;
        }
        String windowKey = budget.provider() + ":" + budget.period() + ":" + budget.periodKey();
        if (warnedWindows.add(windowKey)) {
            log.warn(
                    "Budget utilization crossed {}% (provider={}, period={}, spent={}, limit={})",
                    Math.round(warningRatio * 100),
                    budget.provider(),
                    budget.periodKey(),
                    budget.spentCents(),
                    budget.limitCents());
            metricsSink.emit(MetricNames.BUDGET_WARNING, budget.spentCents(), tags);
        }
    }

    private static double ratioRemaining(Budget budget) {
        if (budget.limitCents() == 0) {
            return 0.0;
        }
        return (double) budget.remainingCents() / budget.limitCents();
    }

    private ProviderBudgets budgetsFor(String provider) {
        ProviderBudgets budgets = budgetsByProvider.get(provider);
        if (budgets == null) {
            throw new IllegalArgumentException("No budget configured for provider: " + provider);
        }
        return budgets;
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(zoneId));
    }

    /**
     * Current daily and monthly windows for one provider.
     */
    private static final class ProviderBudgets {
        private final String provider;
        private final BudgetLimits limits;
        private final AtomicReference<Budget> daily;
        private final AtomicReference<Budget> monthly;

        ProviderBudgets(String provider, BudgetLimits limits, LocalDate today) {
            this.provider = provider;
            this.limits = limits;
            this.daily = new AtomicReference<>(newBudget(BudgetPeriod.DAY, today));
            this.monthly = new AtomicReference<>(newBudget(BudgetPeriod.MONTH, today));
        }

        Budget current(BudgetPeriod period, LocalDate today) {
            rollIfStale(period, today);
            return reference(period).get();
        }

        boolean rollIfStale(BudgetPeriod period, LocalDate today) {
            AtomicReference<Budget> reference = reference(period);
            Budget current = reference.get();
            String periodKey = period.periodKey(today);
            if (current.periodKey().equals(periodKey)) {
                return false;
            }
            return reference.compareAndSet(current, new Budget(provider, period, periodKey, limits.limitFor(period)));
        }

        private Budget newBudget(BudgetPeriod period, LocalDate today) {
            return new Budget(provider, period, period.periodKey(today), limits.limitFor(period));
        }

        private AtomicReference<Budget> reference(BudgetPeriod period) {
            return period == BudgetPeriod.DAY ? daily : monthly;
        }
    }
}
