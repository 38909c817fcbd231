package io.fullerstack.strands.scheduler;

import io.fullerstack.strands.task.Task;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulersTest {

  @Test
  void globalIsBuiltOnceFromGlobalConfig () {
    Scheduler global = Schedulers.global ();

    assertThat ( Schedulers.global () ).isSameAs ( global );
    assertThat ( global.name () ).isEqualTo ( "strands" );
    assertThat ( global.policy () ).isEqualTo ( QueuePolicy.FIFO );
    assertThat ( global.workerCount () ).isEqualTo ( Runtime.getRuntime ().availableProcessors () );
  }

  @Test
  void globalRunsTasks () throws Exception {
    AtomicBoolean ran = new AtomicBoolean ();

    Task task = Schedulers.global ().spawn ( "global-task", () -> ran.set ( true ) );

    assertThat ( task.awaitTermination ( Duration.ofSeconds ( 5 ) ) ).isTrue ();
    assertThat ( ran ).isTrue ();
  }
}
