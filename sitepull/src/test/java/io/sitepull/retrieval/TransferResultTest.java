package io.sitepull.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.sitepull.retrieval.models.TransferResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class TransferResultTest {

  @Test
  void testFoldIsIndependentOfOrder() {
    List<TransferResult> results = new ArrayList<>();
    Random random = new Random(42);
    for (int i = 0; i < 50; i++) {
      results.add(
          i % 7 == 0
              ? TransferResult.failure(1 + random.nextInt(20))
              : new TransferResult(random.nextInt(100), random.nextInt(3), random.nextInt(1 << 20)));
    }
    TransferResult expected = fold(results);

    for (long seed = 0; seed < 20; seed++) {
      List<TransferResult> shuffled = new ArrayList<>(results);
      Collections.shuffle(shuffled, new Random(seed));
      assertEquals(expected, fold(shuffled));
    }
  }

  @Test
  void testCombineIsAssociativeWithEmptyIdentity() {
    TransferResult a = new TransferResult(3, 1, 300);
    TransferResult b = TransferResult.success(5, 50);
    TransferResult c = TransferResult.failure(2);

    assertEquals(a.combine(b).combine(c), a.combine(b.combine(c)));
    assertEquals(a, a.combine(TransferResult.EMPTY));
    assertEquals(a, TransferResult.EMPTY.combine(a));
    assertEquals(new TransferResult(8, 3, 350), a.combine(b).combine(c));
    assertEquals(11, a.combine(b).combine(c).getFilesTotal());
  }

  private static TransferResult fold(List<TransferResult> results) {
    TransferResult total = TransferResult.EMPTY;
    for (TransferResult result : results) {
      total = total.combine(result);
    }
    return total;
  }
}
