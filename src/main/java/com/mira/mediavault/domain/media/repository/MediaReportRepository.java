package com.mira.mediavault.domain.media.repository;

import com.mira.mediavault.domain.media.entity.MediaReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MediaReportRepository extends JpaRepository<MediaReport, Long> {
}
