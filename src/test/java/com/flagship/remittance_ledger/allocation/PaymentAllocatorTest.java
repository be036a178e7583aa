package com.flagship.remittance_ledger.allocation;

import com.flagship.remittance_ledger.exception.RemittanceValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentAllocatorTest {

    private static final Instant T0 = Instant.parse("2026-02-01T00:00:00Z");

    private static OpenItem item(String remaining, String rate, long dayOffset) {
        return new OpenItem(UUID.randomUUID(), T0.plusSeconds(dayOffset * 86_400),
            new BigDecimal(remaining), rate == null ? null : new BigDecimal(rate));
    }

    private static void assertTotals(AllocationPlan plan) {
        BigDecimal sum = plan.getAllocations().stream()
            .map(Allocation::getAllocated)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, sum.compareTo(plan.getTotalAllocated()));
        assertEquals(0, plan.getTotalAllocated().add(plan.getUnallocated()).compareTo(plan.getTotalAmount()));
        plan.getAllocations().forEach(a -> assertTrue(a.getAllocated().compareTo(a.getRemaining()) <= 0));
    }

    @Test
    @DisplayName("FIFO covers the oldest items first and clamps to each remaining")
    void testFifo() {
        OpenItem oldest = item("100.00", null, 0);
        OpenItem middle = item("200.00", null, 1);
        OpenItem newest = item("300.00", null, 2);

        AllocationPlan plan = PaymentAllocator.allocate(List.of(newest, oldest, middle),
            new BigDecimal("250.00"), AllocationMode.FIFO);

        assertEquals(oldest.getId(), plan.getAllocations().get(0).getItemId());
        assertTrue(plan.getAllocations().get(0).isFullyCovered());
        assertEquals(new BigDecimal("150.00"), plan.getAllocations().get(1).getAllocated());
        assertEquals(0, plan.getAllocations().get(2).getAllocated().signum());
        assertEquals(0, plan.getUnallocated().signum());
        assertTotals(plan);
    }

    @Test
    @DisplayName("LIFO covers the newest items first")
    void testLifo() {
        OpenItem oldest = item("100.00", null, 0);
        OpenItem newest = item("300.00", null, 2);

        AllocationPlan plan = PaymentAllocator.allocate(List.of(oldest, newest),
            new BigDecimal("350.00"), AllocationMode.LIFO);

        assertEquals(newest.getId(), plan.getAllocations().get(0).getItemId());
        assertEquals(new BigDecimal("300.00"), plan.getAllocations().get(0).getAllocated());
        assertEquals(new BigDecimal("50.00"), plan.getAllocations().get(1).getAllocated());
        assertTotals(plan);
    }

    @Test
    @DisplayName("BEST_RATE covers the highest rate first and requires rates")
    void testBestRate() {
        OpenItem low = item("100.00", "1.30", 0);
        OpenItem high = item("100.00", "1.40", 5);

        AllocationPlan plan = PaymentAllocator.allocate(List.of(low, high),
            new BigDecimal("120.00"), AllocationMode.BEST_RATE);

        assertEquals(high.getId(), plan.getAllocations().get(0).getItemId());
        assertEquals(new BigDecimal("20.00"), plan.getAllocations().get(1).getAllocated());

        assertThrows(RemittanceValidationException.class, () -> PaymentAllocator.allocate(
            List.of(item("10.00", null, 0)), new BigDecimal("5.00"), AllocationMode.BEST_RATE));
    }

    @Test
    @DisplayName("Payment larger than all open items leaves an unallocated remainder")
    void testOverpayment() {
        AllocationPlan plan = PaymentAllocator.allocate(List.of(item("40.00", null, 0), item("60.00", null, 1)),
            new BigDecimal("150.00"), AllocationMode.FIFO);

        assertEquals(new BigDecimal("100.00"), plan.getTotalAllocated());
        assertEquals(new BigDecimal("50.00"), plan.getUnallocated());
        assertTotals(plan);
    }

    @Test
    @DisplayName("PROPORTIONAL splits by remaining share and hands out leftover cents oldest first")
    void testProportional() {
        OpenItem a = item("100.00", null, 0);
        OpenItem b = item("100.00", null, 1);
        OpenItem c = item("100.00", null, 2);

        AllocationPlan plan = PaymentAllocator.allocate(List.of(c, b, a),
            new BigDecimal("100.00"), AllocationMode.PROPORTIONAL);

        // 33.33 each, one cent left over for the oldest item
        assertEquals(a.getId(), plan.getAllocations().get(0).getItemId());
        assertEquals(new BigDecimal("33.34"), plan.getAllocations().get(0).getAllocated());
        assertEquals(new BigDecimal("33.33"), plan.getAllocations().get(1).getAllocated());
        assertEquals(new BigDecimal("33.33"), plan.getAllocations().get(2).getAllocated());
        assertEquals(0, plan.getUnallocated().signum());
        assertTotals(plan);
    }

    @Test
    @DisplayName("PROPORTIONAL never exceeds an item's remaining balance")
    void testProportional_Clamped() {
        AllocationPlan plan = PaymentAllocator.allocate(List.of(item("10.00", null, 0), item("30.00", null, 1)),
            new BigDecimal("100.00"), AllocationMode.PROPORTIONAL);

        assertTrue(plan.getAllocations().stream().allMatch(Allocation::isFullyCovered));
        assertEquals(new BigDecimal("40.00"), plan.getTotalAllocated());
        assertEquals(new BigDecimal("60.00"), plan.getUnallocated());
        assertTotals(plan);
    }

    @Test
    @DisplayName("Invalid inputs are rejected")
    void testValidation() {
        assertThrows(RemittanceValidationException.class,
            () -> PaymentAllocator.allocate(List.of(), new BigDecimal("10.00"), AllocationMode.FIFO));
        assertThrows(RemittanceValidationException.class,
            () -> PaymentAllocator.allocate(List.of(item("10.00", null, 0)), BigDecimal.ZERO, AllocationMode.FIFO));
        assertThrows(RemittanceValidationException.class,
            () -> PaymentAllocator.allocate(List.of(item("10.00", null, 0)), new BigDecimal("1.001"), AllocationMode.FIFO));
        assertThrows(RemittanceValidationException.class,
            () -> PaymentAllocator.allocate(List.of(item("0.00", null, 0)), new BigDecimal("1.00"), AllocationMode.FIFO));
        assertThrows(RemittanceValidationException.class, () -> AllocationMode.parse("HIGHEST"));
        assertEquals(AllocationMode.FIFO, AllocationMode.parse(null));
    }
}
