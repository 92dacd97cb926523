package com.campus.portal.repository;

import com.campus.portal.entity.EventRegistration;
import com.campus.portal.entity.RegistrationStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface EventRegistrationRepository extends JpaRepository<EventRegistration, Long> {

    List<EventRegistration> findByUser_IdAndStatusInOrderByRegistrationDateDesc(
            Long userId, Collection<RegistrationStatus> statuses);
}
