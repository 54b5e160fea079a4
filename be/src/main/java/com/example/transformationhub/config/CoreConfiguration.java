package com.example.transformationhub.config;

import com.example.transformationhub.codegen.WorkflowCodeGenerator;
import com.example.transformationhub.nesting.NestingResolver;
import com.example.transformationhub.store.RevisionStore;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfiguration {

    @Bean
    public NestingResolver nestingResolver(
            RevisionStore revisionStore,
            @Value("${transformations.nesting.max-depth:64}") int maxDepth) {
        return new NestingResolver(revisionStore, maxDepth);
    }

    @Bean
    public WorkflowCodeGenerator workflowCodeGenerator(RevisionStore revisionStore) {
        return new WorkflowCodeGenerator(revisionStore);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
