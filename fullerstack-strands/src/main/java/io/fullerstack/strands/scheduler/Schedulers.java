package io.fullerstack.strands.scheduler;

import io.fullerstack.strands.config.HierarchicalConfig;

/**
 * Process-wide {@link Scheduler}, built lazily from {@link HierarchicalConfig#global()}.
 * <p>
 * A convenience for code that has no scheduler handed to it. Independent schedulers
 * created with {@link Scheduler#builder()} work alongside it and are preferred wherever
 * a scheduler can be passed explicitly. Once a caller shuts the global scheduler down it
 * stays down for the rest of the process.
 */
public final class Schedulers {

  private Schedulers () {
  }

  private static final class Holder {
    static final Scheduler GLOBAL = Scheduler.fromConfig ( HierarchicalConfig.global () );
  }

  public static Scheduler global () {
    return Holder.GLOBAL;
  }
}
