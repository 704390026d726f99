package com.welie.blecore;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ReconnectPolicyTest {

    @Mock
    Random random;

    @Test
    void Given_no_jitter_when_attempts_increase_then_the_delay_grows_until_the_ceiling() {
        ReconnectPolicy policy = new ReconnectPolicy(6, 1000, 2.0, 5000, 0.0);
        Random seeded = new Random(42);

        assertEquals(1000, policy.getDelay(1, seeded));
        assertEquals(2000, policy.getDelay(2, seeded));
        assertEquals(4000, policy.getDelay(3, seeded));
        assertEquals(5000, policy.getDelay(4, seeded));
        assertEquals(5000, policy.getDelay(6, seeded));
    }

    @Test
    void Given_jitter_when_random_is_at_its_extremes_then_the_delay_stays_within_the_jitter_band() {
        ReconnectPolicy policy = new ReconnectPolicy(3, 1000, 2.0, 10000, 0.1);

        when(random.nextDouble()).thenReturn(0.0, 1.0, 0.5);

        assertEquals(1800, policy.getDelay(2, random));
        assertEquals(2200, policy.getDelay(2, random));
        assertEquals(2000, policy.getDelay(2, random));
    }

    @Test
    void Given_jitter_at_the_ceiling_then_the_delay_never_exceeds_the_ceiling() {
        ReconnectPolicy policy = new ReconnectPolicy(10, 1000, 2.0, 4000, 0.5);
        Random seeded = new Random(7);

        for (int attempt = 1; attempt <= 10; attempt++) {
            long delay = policy.getDelay(attempt, seeded);
            assertTrue(delay >= 0 && delay <= 4000, "delay " + delay + " out of range");
        }
    }

    @Test
    void Given_the_none_policy_then_it_is_disabled() {
        assertFalse(ReconnectPolicy.NONE.isEnabled());
        assertEquals(0, ReconnectPolicy.NONE.getMaxAttempts());
        assertTrue(new ReconnectPolicy(1, 0, 1.0, 0, 0.0).isEnabled());
    }

    @Test
    void Constructor_rejects_invalid_arguments() {
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(-1, 1000, 2.0, 5000, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(3, -1, 2.0, 5000, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(3, 1000, 0.5, 5000, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(3, 1000, 2.0, 500, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(3, 1000, 2.0, 5000, 1.5));
    }

    @Test
    void When_asking_the_delay_for_attempt_zero_then_an_exception_is_thrown() {
        ReconnectPolicy policy = new ReconnectPolicy(3, 1000, 2.0, 5000, 0.0);
        assertThrows(IllegalArgumentException.class, () -> policy.getDelay(0, new Random()));
        assertThrows(NullPointerException.class, () -> policy.getDelay(1, null));
    }
}
