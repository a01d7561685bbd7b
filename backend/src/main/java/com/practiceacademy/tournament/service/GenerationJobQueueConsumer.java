package com.practiceacademy.tournament.service;

@FunctionalInterface
public interface GenerationJobQueueConsumer {

    void accept(GenerationJobMessage message);
}
