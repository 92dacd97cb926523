package com.campus.portal.repository;

import com.campus.portal.entity.EventFeedback;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EventFeedbackRepository extends JpaRepository<EventFeedback, Long> {

    boolean existsByEvent_IdAndUser_Id(Long eventId, Long userId);

    List<EventFeedback> findByEvent_IdOrderByCreatedAtDesc(Long eventId);

    void deleteByEvent_Id(Long eventId);
}
