package dev.hrats.repository;

import dev.hrats.entity.ApplicantHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ApplicantHistoryRepository extends JpaRepository<ApplicantHistoryEntry, Long> {

    List<ApplicantHistoryEntry> findByApplicantIdOrderByIdAsc(Long applicantId);

    @Modifying
    @Query("DELETE FROM ApplicantHistoryEntry h WHERE h.applicantId = :applicantId")
    int deleteByApplicantId(@Param("applicantId") Long applicantId);
}
