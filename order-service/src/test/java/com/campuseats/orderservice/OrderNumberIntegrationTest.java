package com.campuseats.orderservice;

import com.campuseats.orderservice.service.OrderNumberGenerator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

public class OrderNumberIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private OrderNumberGenerator orderNumberGenerator;

    @Test
    void should_hand_out_unique_gapless_sequences_under_concurrency() throws Exception {
        // Arrange
        UUID vendorId = UUID.randomUUID();
        int calls = 10_000;
        ExecutorService executor = Executors.newFixedThreadPool(32);
        List<Callable<String>> tasks = new ArrayList<>();
        for (int i = 0; i < calls; i++) {
            UUID holder = UUID.randomUUID();
            tasks.add(() -> orderNumberGenerator.next(vendorId, holder));
        }

        // Act
        List<String> numbers = new ArrayList<>();
        for (Future<String> future : executor.invokeAll(tasks, 5, TimeUnit.MINUTES)) {
            numbers.add(future.get());
        }
        executor.shutdown();

        // Assert
        assertThat(new HashSet<>(numbers)).hasSize(calls);
        Set<Integer> sequences = numbers.stream()
                .map(number -> Integer.parseInt(number.substring(number.lastIndexOf('-') + 1)))
                .collect(Collectors.toSet());
        assertThat(sequences).hasSize(calls);
        assertThat(sequences).allMatch(seq -> seq >= 1 && seq <= calls);
    }

    @Test
    void should_keep_separate_sequences_per_vendor() {
        // Arrange
        UUID vendorA = UUID.randomUUID();
        UUID vendorB = UUID.randomUUID();
        UUID holder = UUID.randomUUID();

        // Act
        String a1 = orderNumberGenerator.next(vendorA, holder);
        String b1 = orderNumberGenerator.next(vendorB, holder);
        String a2 = orderNumberGenerator.next(vendorA, holder);

        // Assert
        assertThat(a1).endsWith("-00001");
        assertThat(b1).endsWith("-00001");
        assertThat(a2).endsWith("-00002");
    }
}
