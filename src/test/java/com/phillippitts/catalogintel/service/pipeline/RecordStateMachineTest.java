package com.phillippitts.catalogintel.service.pipeline;

import com.phillippitts.catalogintel.domain.PipelineStage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordStateMachineTest {

    @Test
    void walksStagesInOrder() {
        var machine = new RecordStateMachine();

        assertThat(machine.nextStage()).isEqualTo(PipelineStage.INGEST);
        machine.complete(PipelineStage.INGEST);
        assertThat(machine.nextStage()).isEqualTo(PipelineStage.ENRICH);
        machine.complete(PipelineStage.ENRICH);
        assertThat(machine.nextStage()).isEqualTo(PipelineStage.VISION);
        machine.complete(PipelineStage.VISION);
        assertThat(machine.nextStage()).isEqualTo(PipelineStage.FUSE);
        machine.complete(PipelineStage.FUSE);
        machine.succeed();

        assertThat(machine.current()).isEqualTo(PipelineState.SUCCEEDED);
        assertThat(machine.failedStage()).isNull();
    }

    @Test
    void rejectsOutOfOrderCompletion() {
        var machine = new RecordStateMachine();

        assertThatThrownBy(() -> machine.complete(PipelineStage.VISION))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failureIsTerminal() {
        var machine = new RecordStateMachine();
        machine.complete(PipelineStage.INGEST);

        machine.fail(PipelineStage.ENRICH);

        assertThat(machine.current()).isEqualTo(PipelineState.FAILED);
        assertThat(machine.failedStage()).isEqualTo(PipelineStage.ENRICH);
        assertThatThrownBy(() -> machine.fail(PipelineStage.VISION)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(machine::nextStage).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cannotSucceedEarly() {
        var machine = new RecordStateMachine();

        assertThatThrownBy(machine::succeed).isInstanceOf(IllegalStateException.class);
    }
}
