package com.ivamare.ordersaga.compensation;

import com.ivamare.ordersaga.command.SagaCommandType;
import com.ivamare.ordersaga.decider.Decider;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.support.SagaFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CompensationPolicy")
class CompensationPolicyTest {

    private final CompensationPolicy policy = CompensationPolicy.defaultPolicy();

    static Stream<Arguments> fulfillmentFailures() {
        return Stream.of(
            Arguments.of(EnumSet.noneOf(CompletedStep.class), List.of()),
            Arguments.of(EnumSet.of(CompletedStep.PAYMENT_CAPTURED),
                List.of(SagaCommandType.REFUND_PAYMENT)),
            Arguments.of(EnumSet.of(CompletedStep.INVENTORY_COMMITTED),
                List.of(SagaCommandType.RELEASE_RESERVATION)),
            Arguments.of(EnumSet.of(CompletedStep.PAYMENT_CAPTURED, CompletedStep.INVENTORY_COMMITTED),
                List.of(SagaCommandType.RELEASE_RESERVATION, SagaCommandType.REFUND_PAYMENT))
        );
    }

    @ParameterizedTest(name = "fulfillment failure after {0} -> {1}")
    @MethodSource("fulfillmentFailures")
    void fulfillmentFailureCompensatesCompletedSteps(Set<CompletedStep> completed, List<SagaCommandType> expected) {
        assertEquals(expected, policy.compensationsFor(FailedStep.FULFILLMENT, completed));
    }

    @Test
    @DisplayName("authorization failure never compensates")
    void authorizationFailure() {
        assertEquals(List.of(), policy.compensationsFor(FailedStep.PAYMENT_AUTHORIZATION,
            EnumSet.allOf(CompletedStep.class)));
    }

    @Test
    @DisplayName("reservation failure refunds only a requested capture")
    void reservationFailure() {
        assertEquals(List.of(), policy.compensationsFor(FailedStep.INVENTORY_RESERVATION,
            EnumSet.of(CompletedStep.PAYMENT_AUTHORIZED)));
        assertEquals(List.of(SagaCommandType.REFUND_PAYMENT), policy.compensationsFor(
            FailedStep.INVENTORY_RESERVATION, EnumSet.of(CompletedStep.CAPTURE_REQUESTED)));
    }

    @Test
    @DisplayName("capture failure releases a held reservation")
    void captureFailure() {
        assertEquals(List.of(SagaCommandType.RELEASE_RESERVATION), policy.compensationsFor(
            FailedStep.PAYMENT_CAPTURE, EnumSet.of(CompletedStep.PAYMENT_AUTHORIZED, CompletedStep.INVENTORY_RESERVED)));
    }

    @Test
    @DisplayName("custom table is honoured and missing steps compensate nothing")
    void customTable() {
        CompensationPolicy custom = new CompensationPolicy(Map.of(
            FailedStep.PAYMENT_CAPTURE, List.of(new CompensationPolicy.Entry(
                SagaCommandType.REFUND_PAYMENT, EnumSet.of(CompletedStep.PAYMENT_AUTHORIZED)))
        ));

        assertEquals(List.of(SagaCommandType.REFUND_PAYMENT), custom.compensationsFor(
            FailedStep.PAYMENT_CAPTURE, EnumSet.of(CompletedStep.PAYMENT_AUTHORIZED)));
        assertTrue(custom.entriesFor(FailedStep.FULFILLMENT).isEmpty());
    }

    @Nested
    @DisplayName("CompletedStep.of")
    class CompletedSteps {

        private final Decider decider = new Decider();
        private final UUID orderId = UUID.randomUUID();

        @Test
        @DisplayName("placed order has nothing to undo")
        void placed() {
            assertEquals(EnumSet.noneOf(CompletedStep.class),
                CompletedStep.of(SagaFixtures.placed(decider, orderId)));
        }

        @Test
        @DisplayName("capturing order has an in-flight capture")
        void capturing() {
            OrderSaga state = SagaFixtures.capturing(decider, orderId);

            assertEquals(EnumSet.of(CompletedStep.PAYMENT_AUTHORIZED, CompletedStep.CAPTURE_REQUESTED,
                CompletedStep.INVENTORY_RESERVED), CompletedStep.of(state));
        }

        @Test
        @DisplayName("shipped order has every step")
        void shipped() {
            OrderSaga state = SagaFixtures.shipped(decider, orderId);

            assertEquals(EnumSet.allOf(CompletedStep.class), CompletedStep.of(state));
        }
    }
}
