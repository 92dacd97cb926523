package com.campus.portal.repository;

import com.campus.portal.entity.AttendanceRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {

    List<AttendanceRecord> findByEvent_Id(Long eventId);

    List<AttendanceRecord> findByUser_IdOrderByMarkedAtDesc(Long userId);

    long countByEvent_Id(Long eventId);

    void deleteByEvent_Id(Long eventId);
}
