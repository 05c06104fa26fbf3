package dev.hrats.repository;

import dev.hrats.entity.Applicant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for applicant records.
 */
@Repository
public interface ApplicantRepository extends JpaRepository<Applicant, Long>, JpaSpecificationExecutor<Applicant> {

    /**
     * Count applicants per status. Each row is {status, count}.
     */
    @Query("SELECT a.status, COUNT(a) FROM Applicant a GROUP BY a.status")
    List<Object[]> countGroupedByStatus();
}
