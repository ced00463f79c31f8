package pooled.treasury.domain.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.error.exception.DuplicateMemberException;
import pooled.treasury.error.exception.InvalidConfigException;
import pooled.treasury.error.exception.NotMemberException;

/**
 * 현재 멤버 집합
 *
 * <p>삽입 순서를 유지하며, 제거 후에도 남은 멤버의 상대 순서가 바뀌지 않습니다. 변경은 실행된 거버넌스 제안을 통해서만 일어납니다.
 */
public final class MembershipRegistry {

  private final Set<PrincipalId> members = new LinkedHashSet<>();

  private MembershipRegistry() {}

  /**
   * 초기 멤버로 생성
   *
   * @throws InvalidConfigException 비어 있거나 null/중복 멤버가 있는 경우
   */
  public static MembershipRegistry of(List<PrincipalId> initialMembers) {
    if (initialMembers == null || initialMembers.isEmpty()) {
      throw new InvalidConfigException("initial member list must not be empty");
    }
    MembershipRegistry registry = new MembershipRegistry();
    for (PrincipalId member : initialMembers) {
      if (member == null) {
        throw new InvalidConfigException("initial member list must not contain null");
      }
      if (!registry.members.add(member)) {
        throw new InvalidConfigException("duplicate initial member: " + member);
      }
    }
    return registry;
  }

  public boolean isMember(PrincipalId principal) {
    return members.contains(principal);
  }

  public void add(PrincipalId principal) {
    if (!members.add(principal)) {
      throw new DuplicateMemberException(principal.value());
    }
  }

  public void remove(PrincipalId principal) {
    if (!members.remove(principal)) {
      throw new NotMemberException(principal.value());
    }
  }

  public List<PrincipalId> list() {
    return List.copyOf(members);
  }

  public int size() {
    return members.size();
  }
}
