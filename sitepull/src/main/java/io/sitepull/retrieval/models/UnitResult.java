package io.sitepull.retrieval.models;

import io.sitepull.constants.MetricsConstants.UnitFailureReasons;
import io.sitepull.manifest.models.TransferUnit;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.Value;

/** Message a worker sends to the collector once it is done with a unit. */
@Value
public class UnitResult {
  @NonNull TransferUnit unit;
  @NonNull TransferResult result;
  int attempts;
  @Nullable UnitFailureReasons failureReason;

  public boolean isFailed() {
    return failureReason != null;
  }

  public Optional<UnitFailureReasons> getFailure() {
    return Optional.ofNullable(failureReason);
  }
}
