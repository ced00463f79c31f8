package pooled.treasury.domain.model.record;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongFunction;
import pooled.treasury.error.exception.NotFoundException;

/**
 * 위치 인덱스로 접근하는 append-only 레코드 로그
 *
 * <p>id는 0부터 순차 부여되며 삭제는 없습니다.
 *
 * @param <R> 레코드 타입
 */
public final class RecordLog<R extends GovernedRecord> {

  private final RecordKind kind;
  private final List<R> records = new ArrayList<>();

  public RecordLog(RecordKind kind) {
    this.kind = kind;
  }

  /** 다음 id로 레코드를 만들어 추가하고 반환 */
  public R append(LongFunction<R> factory) {
    R record = factory.apply(records.size());
    records.add(record);
    return record;
  }

  public R get(long id) {
    if (id < 0 || id >= records.size()) {
      throw new NotFoundException(kind.label(), id);
    }
    return records.get((int) id);
  }

  public int size() {
    return records.size();
  }
}
