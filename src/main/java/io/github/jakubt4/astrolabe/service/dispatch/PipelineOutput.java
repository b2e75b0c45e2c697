package io.github.jakubt4.astrolabe.service.dispatch;

import java.util.List;

record PipelineOutput(Object payload, List<String> narrative) {

    PipelineOutput {
        narrative = List.copyOf(narrative);
    }
}
