package com.vidnyan.heuristic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Heuristic scoring engine for captured web pages.
 *
 * Scores extracted HTML and screenshot features into a 0-100 usability score
 * with per-category breakdown and ranked recommendations.
 */
@SpringBootApplication
public class HeuristicApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeuristicApplication.class, args);
    }
}
