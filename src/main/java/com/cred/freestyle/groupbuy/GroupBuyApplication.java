package com.cred.freestyle.groupbuy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the car group-buying service.
 *
 * System Overview:
 * - Users pay a participation fee, then join a buying group for a car model in their city
 * - A group locks when it reaches capacity; admins then submit dealer offers
 * - Members vote on offers (one vote each, switchable) until an admin completes the group
 *
 * Architecture:
 * - API Layer: REST controllers with validation and JWT authentication
 * - Service Layer: membership state machine, payments, preferences, offers and voting
 * - Data Access Layer: JPA repositories with pessimistic group locks and conditional updates
 * - Infrastructure Layer: Redis read cache, Kafka domain events, CloudWatch metrics
 *
 * @author Group Buy Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class GroupBuyApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroupBuyApplication.class, args);
    }
}
