/*
 * どこで: Alerting 配信層
 * 何を: 送信に使うプロバイダを選び、クォータを予約する
 * なぜ: 条件付き UPDATE 1 本で消費し、並行実行でも上限を超えないようにするため
 */
package com.example.alerting.delivery;

import com.example.alerting.model.ProviderAccount;
import com.example.alerting.model.ProviderQuotaStatus;
import com.example.alerting.repository.ProviderAccountRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProviderRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ProviderRegistry.class);

  private final ProviderAccountRepository providerAccountRepository;

  public ProviderAccount selectProvider(UUID preferredProviderId, Instant now) {
    return selectProvider(preferredProviderId, Set.of(), now);
  }

  /**
   * 優先プロバイダが有効でクォータ内ならそれを、そうでなければ priority 順で最初に条件を満たす
   * プロバイダを返す。
   *
   * @param excluded 現在の実行で使用をやめたプロバイダ (クォータ到達または認証拒否)
   * @throws NoEligibleProviderException 全プロバイダが無効/除外/クォータ到達のとき
   */
  public ProviderAccount selectProvider(
      UUID preferredProviderId, Set<UUID> excluded, Instant now) {
    final List<ProviderAccount> candidates = providerAccountRepository.findActiveOrderedByPriority();
    if (preferredProviderId != null) {
      final Optional<ProviderAccount> preferred =
          candidates.stream()
              .filter(provider -> provider.providerId().equals(preferredProviderId))
              .filter(provider -> isEligible(provider, excluded, now))
              .findFirst();
      if (preferred.isPresent()) {
        return preferred.get();
      }
      logger.info(
          "preferred provider not eligible, falling back providerId={}", preferredProviderId);
    }
    return candidates.stream()
        .filter(provider -> isEligible(provider, excluded, now))
        .findFirst()
        .orElseThrow(
            () ->
                new NoEligibleProviderException(
                    "no active provider with remaining quota (candidates="
                        + candidates.size()
                        + ", excluded="
                        + excluded.size()
                        + ")"));
  }

  /** クォータを 1 単位消費する。プロバイダが上限に達していれば false を返す。 */
  public boolean reserveQuota(ProviderAccount provider, Instant now) {
    final boolean reserved =
        providerAccountRepository.tryReserveQuota(
            provider.providerId(), now, now.minus(ProviderAccount.QUOTA_WINDOW));
    if (!reserved) {
      logger.warn(
          "provider quota exhausted provider={} dailyQuota={}",
          provider.name(),
          provider.dailyQuota());
    }
    return reserved;
  }

  public List<ProviderQuotaStatus> quotaStatus(Instant now) {
    return providerAccountRepository.findAll().stream()
        .map(
            provider ->
                new ProviderQuotaStatus(
                    provider.providerId(),
                    provider.name(),
                    provider.active(),
                    provider.testMode(),
                    provider.usedInWindow(now),
                    provider.dailyQuota(),
                    provider.quotaWindowStartedAt()))
        .toList();
  }

  private boolean isEligible(ProviderAccount provider, Set<UUID> excluded, Instant now) {
    return provider.active() && !excluded.contains(provider.providerId()) && provider.hasQuota(now);
  }
}
