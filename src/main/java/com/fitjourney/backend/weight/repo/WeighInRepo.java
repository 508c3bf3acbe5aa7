package com.fitjourney.backend.weight.repo;

import com.fitjourney.backend.weight.entity.WeighIn;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface WeighInRepo extends JpaRepository<WeighIn, Long> {

    Optional<WeighIn> findByUserIdAndLogDate(Long userId, LocalDate logDate);

    boolean existsByUserId(Long userId);

    long countByUserIdAndLogDateGreaterThanEqual(Long userId, LocalDate from);

    @Query("""
           select w from WeighIn w
           where w.userId = :uid
           order by w.logDate desc
           """)
    List<WeighIn> findLatest(@Param("uid") Long uid, Pageable pageable);
}
