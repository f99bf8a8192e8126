package com.shlokmestry.flowlimit.ratelimit;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

class FlowTest {

    static final long DAY = 60 * 60 * 24;
    static final long WEEK = DAY * 7;

    private static final Instant EPOCH = Instant.ofEpochSecond(0);

    @Test
    void expiry_isStrictlyAfterPeriodEnd() {
        Flow flow = Flow.startingAt(EPOCH, WEEK);

        assertThat(flow.isExpired(EPOCH)).isFalse();
        assertThat(flow.isExpired(EPOCH.plusSeconds(DAY))).isFalse();
        assertThat(flow.isExpired(EPOCH.plusSeconds(WEEK))).isFalse();
        assertThat(flow.isExpired(EPOCH.plusSeconds(WEEK).plusNanos(1))).isTrue();
    }

    @Test
    void balance_netsOppositeDirections() {
        Flow flow = Flow.startingAt(EPOCH, WEEK);
        assertThat(flow.balance()).isEqualTo(new DirectionalAmount(Amount.ZERO, Amount.ZERO));

        flow.addFlow(FlowDirection.IN, Amount.of(5));
        assertThat(flow.balance()).isEqualTo(new DirectionalAmount(Amount.of(5), Amount.ZERO));

        flow.addFlow(FlowDirection.OUT, Amount.of(2));
        assertThat(flow.balance()).isEqualTo(new DirectionalAmount(Amount.of(3), Amount.ZERO));

        flow.addFlow(FlowDirection.OUT, Amount.of(10));
        assertThat(flow.balance()).isEqualTo(new DirectionalAmount(Amount.ZERO, Amount.of(7)));

        // adding flow doesn't move the window
        assertThat(flow.isExpired(EPOCH.plusSeconds(DAY))).isFalse();
    }

    @Test
    void balance_canBeZeroWithLargeGrossFlow() {
        Flow flow = Flow.startingAt(EPOCH, WEEK);
        flow.addFlow(FlowDirection.OUT, Amount.parse("1000000000000000000000000"));
        flow.addFlow(FlowDirection.IN, Amount.parse("1000000000000000000000000"));

        assertThat(flow.balanceOn(FlowDirection.IN)).isEqualTo(Amount.ZERO);
        assertThat(flow.balanceOn(FlowDirection.OUT)).isEqualTo(Amount.ZERO);
        assertThat(flow.getInflow()).isEqualTo(Amount.parse("1000000000000000000000000"));
    }

    @Test
    void expire_resetsCountersAndAnchorsWindowAtNow() {
        Flow flow = Flow.startingAt(EPOCH, WEEK);
        flow.addFlow(FlowDirection.IN, Amount.of(5));

        flow.expire(EPOCH.plusSeconds(WEEK), WEEK);

        assertThat(flow.getInflow()).isEqualTo(Amount.ZERO);
        assertThat(flow.getOutflow()).isEqualTo(Amount.ZERO);
        assertThat(flow.getPeriodEnd()).isEqualTo(EPOCH.plusSeconds(WEEK * 2));
        assertThat(flow.isExpired(EPOCH.plusSeconds(WEEK).plusNanos(1))).isFalse();
        assertThat(flow.isExpired(EPOCH.plusSeconds(WEEK * 2))).isFalse();
        assertThat(flow.isExpired(EPOCH.plusSeconds(WEEK * 2).plusNanos(1))).isTrue();
    }

    @Test
    void applyTransfer_afterLongIdle_startsOneWindowFromTheCall() {
        Quota weekly = new Quota("weekly", Amount.of(1000), Amount.of(1000), WEEK);
        Flow flow = Flow.startingAt(EPOCH, WEEK);
        flow.addFlow(FlowDirection.OUT, Amount.of(300));

        Instant later = EPOCH.plusSeconds(WEEK * 5 + 123);
        boolean expired = flow.applyTransfer(FlowDirection.OUT, Amount.of(800), later, weekly);

        assertThat(expired).isTrue();
        assertThat(flow.getOutflow()).isEqualTo(Amount.of(800));
        assertThat(flow.getPeriodEnd()).isEqualTo(later.plusSeconds(WEEK));
    }

    @Test
    void applyTransfer_atPeriodEnd_staysInWindow() {
        Quota weekly = new Quota("weekly", Amount.of(1000), Amount.of(1000), WEEK);
        Flow flow = Flow.startingAt(EPOCH, WEEK);
        flow.addFlow(FlowDirection.OUT, Amount.of(300));

        boolean expired = flow.applyTransfer(FlowDirection.OUT, Amount.of(100), EPOCH.plusSeconds(WEEK), weekly);

        assertThat(expired).isFalse();
        assertThat(flow.getOutflow()).isEqualTo(Amount.of(400));
        assertThat(flow.getPeriodEnd()).isEqualTo(EPOCH.plusSeconds(WEEK));
    }

    @Test
    void undoFlow_saturatesAndKeepsWindow() {
        Flow flow = Flow.startingAt(EPOCH, WEEK);
        flow.addFlow(FlowDirection.OUT, Amount.of(100));

        flow.undoFlow(FlowDirection.OUT, Amount.of(250));

        assertThat(flow.getOutflow()).isEqualTo(Amount.ZERO);
        assertThat(flow.getPeriodEnd()).isEqualTo(EPOCH.plusSeconds(WEEK));
    }

    @Test
    void addFlow_saturatesAtMax() {
        Flow flow = Flow.startingAt(EPOCH, WEEK);
        flow.addFlow(FlowDirection.OUT, Amount.MAX);
        flow.addFlow(FlowDirection.OUT, Amount.of(1));

        assertThat(flow.getOutflow()).isEqualTo(Amount.MAX);
        assertThat(flow.exceeds(FlowDirection.OUT, Amount.MAX, Amount.MAX)).isFalse();
    }

    @Test
    void zeroDuration_expiresOnTheNextSecond() {
        Quota instant = new Quota("instant", Amount.of(10), Amount.of(10), 0);
        Flow flow = Flow.startingAt(EPOCH, 0);

        assertThat(flow.applyTransfer(FlowDirection.OUT, Amount.of(5), EPOCH, instant)).isFalse();
        assertThat(flow.applyTransfer(FlowDirection.OUT, Amount.of(5), EPOCH.plusSeconds(1), instant)).isTrue();
        assertThat(flow.getOutflow()).isEqualTo(Amount.of(5));
    }

    @Test
    void windowEnd_saturatesInsteadOfOverflowing() {
        Flow flow = Flow.startingAt(EPOCH, Long.MAX_VALUE);

        assertThat(flow.getPeriodEnd()).isEqualTo(Instant.MAX);
        assertThat(flow.isExpired(EPOCH.plusSeconds(WEEK * 52 * 1000))).isFalse();
    }

    @Test
    void copy_isIndependent() {
        Flow flow = Flow.startingAt(EPOCH, WEEK);
        Flow copy = flow.copy();
        copy.addFlow(FlowDirection.IN, Amount.of(9));

        assertThat(flow.getInflow()).isEqualTo(Amount.ZERO);
        assertThat(copy.getInflow()).isEqualTo(Amount.of(9));
    }
}
