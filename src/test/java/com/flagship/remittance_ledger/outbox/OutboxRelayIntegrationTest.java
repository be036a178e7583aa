package com.flagship.remittance_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.remittance_ledger.common.CurrencyCode;
import com.flagship.remittance_ledger.remittance.CreateOutgoingCommand;
import com.flagship.remittance_ledger.remittance.OutgoingRemittance;
import com.flagship.remittance_ledger.remittance.RemittanceService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end relay: a remittance written to the outbox reaches Kafka keyed by
 * its id, and the outbox row is marked published.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxRelayIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("remittance_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("spring.data.redis.port", () -> "6399");
        // relay is triggered by the test; the scheduled poll only fires once at startup
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private RemittanceService remittanceService;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${kafka.topic.remittances:remittance-events}")
    private String remittancesTopic;

    private KafkaConsumer<String, String> consumer;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(remittancesTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private List<ConsumerRecord<String, String>> pollFor(String key, Duration timeout) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (matching.isEmpty() && System.nanoTime() < deadline) {
            for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofMillis(500))) {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            }
        }
        return matching;
    }

    @Test
    @DisplayName("Creation event is relayed to Kafka and marked published")
    void testRelay_PublishesCreatedEvent() throws Exception {
        printTestHeader("Outbox Relay");

        OutgoingRemittance outgoing = remittanceService.createOutgoing(CreateOutgoingCommand.builder()
            .tenantId(UUID.randomUUID())
            .branchId(UUID.randomUUID())
            .actorId(UUID.randomUUID())
            .senderName("Sender")
            .senderPhone("+1-604-555-0133")
            .recipientName("Recipient")
            .currency(CurrencyCode.IRR)
            .amount(new BigDecimal("850000.00"))
            .acquisitionRate(new BigDecimal("85000"))
            .fundingCurrency(CurrencyCode.CAD)
            .receivedAmount(new BigDecimal("10.00"))
            .build());

        List<OutboxEvent> pending = outboxService.getEventsForAggregate(OutboxService.OUTGOING_AGGREGATE, outgoing.getId());
        assertEquals(1, pending.size());
        assertFalse(pending.get(0).isPublished());

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = pollFor(outgoing.getId().toString(), Duration.ofSeconds(30));
        assertEquals(1, records.size(), "One event keyed by the remittance id");

        JsonNode payload = objectMapper.readTree(records.get(0).value());
        assertEquals("RemittanceCreated", payload.get("event_type").asText());
        assertEquals(outgoing.getId().toString(), payload.get("remittance_id").asText());
        assertEquals(outgoing.getRemittanceCode(), payload.get("remittance_code").asText());

        List<OutboxEvent> after = outboxService.getEventsForAggregate(OutboxService.OUTGOING_AGGREGATE, outgoing.getId());
        assertTrue(after.get(0).isPublished());
        assertEquals(0, after.get(0).getRetryCount());

        printSuccess("Event relayed and marked published");
    }
}
