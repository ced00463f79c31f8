package pooled.treasury.domain.event;

import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;

/**
 * 입금 수신
 *
 * @param sender 입금자 (멤버가 아니어도 됨)
 * @param amount 입금액
 * @param balance 입금 반영 후 금고 잔액
 */
public record DepositReceived(PrincipalId sender, Amount amount, Amount balance)
    implements TreasuryEvent {}
