package org.iceforge.runa.budget;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BudgetAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BudgetAnalyticsApplication.class, args);
    }
}
