package pooled.treasury.global.executor;

import java.util.Objects;

/**
 * 작업 컨텍스트
 *
 * <p>로그에 남길 작업 이름을 {@code component:operation:dynamicValue} 형식으로 구조화합니다.
 *
 * <pre>
 * TaskContext.of("Treasury", "executeAction", "7") → "Treasury:executeAction:7"
 * TaskContext.of("Treasury", "getBalance")         → "Treasury:getBalance"
 * </pre>
 *
 * @param component 컴포넌트 이름 (예: "Treasury", "Effect")
 * @param operation 작업 유형 (예: "deposit", "approveAction")
 * @param dynamicValue 동적 값 (예: 레코드 id)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
