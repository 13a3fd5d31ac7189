package org.crmbridge.account.base;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cloud.stream.binder.test.TestChannelBinderConfiguration;
import org.springframework.context.annotation.Import;

/**
 * Base class for integration tests.
 *
 * <p>Provides the full Spring Boot application context with the Spring Cloud Stream test binder in
 * place of RabbitMQ. Published events can be read back through {@link
 * org.springframework.cloud.stream.binder.test.OutputDestination}.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestChannelBinderConfiguration.class)
public abstract class AbstractIntegrationTest {}
