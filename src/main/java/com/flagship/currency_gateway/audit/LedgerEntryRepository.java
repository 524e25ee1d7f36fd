package com.flagship.currency_gateway.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntryEntity, Long> {

    /**
     * History of one account, newest first. Ties on timestamp fall back to the insert order.
     */
    List<LedgerEntryEntity> findByUserIdAndBankNameOrderByTimestampDescIdDesc(String userId, String bankName);

    Optional<LedgerEntryEntity> findFirstByUserIdAndBankNameAndDiscordIdIsNotNullOrderByTimestampDescIdDesc(
            String userId, String bankName);

    /**
     * Deletes one entry and reports how many rows went away, unlike {@code deleteById}
     * which is silent about missing rows.
     */
    @Modifying
    @Query("DELETE FROM LedgerEntryEntity e WHERE e.id = :id")
    int deleteEntryById(@Param("id") Long id);

    long countByUserIdAndBankName(String userId, String bankName);
}
