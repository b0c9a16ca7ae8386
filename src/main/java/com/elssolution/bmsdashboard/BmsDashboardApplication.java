package com.elssolution.bmsdashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BmsDashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(BmsDashboardApplication.class, args);
    }

}
