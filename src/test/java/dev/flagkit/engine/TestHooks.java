package dev.flagkit.engine;

import dev.flagkit.engine.integrations.ConfigLoadRecord;
import dev.flagkit.engine.integrations.ConfigRollbackRecord;
import dev.flagkit.engine.integrations.EvaluationRecord;
import dev.flagkit.engine.integrations.Hook;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@SuppressWarnings("javadoc")
public class TestHooks {
  public static class RecordingHook extends Hook {
    public final List<EvaluationRecord> evaluations = new CopyOnWriteArrayList<>();
    public final List<ConfigLoadRecord> loads = new CopyOnWriteArrayList<>();
    public final List<ConfigRollbackRecord> rollbacks = new CopyOnWriteArrayList<>();

    public RecordingHook() {
      super("recording");
    }

    @Override
    public void afterEvaluation(EvaluationRecord record) {
      evaluations.add(record);
    }

    @Override
    public void afterConfigLoad(ConfigLoadRecord record) {
      loads.add(record);
    }

    @Override
    public void afterConfigRollback(ConfigRollbackRecord record) {
      rollbacks.add(record);
    }
  }

  public static class FailingHook extends Hook {
    public FailingHook() {
      super("failing");
    }

    @Override
    public void afterEvaluation(EvaluationRecord record) {
      throw new RuntimeException("sorry");
    }

    @Override
    public void afterConfigLoad(ConfigLoadRecord record) {
      throw new RuntimeException("sorry");
    }
  }
}
