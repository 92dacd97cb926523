package com.campus.portal.repository;

import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface EventRepository extends JpaRepository<Event, Long>, JpaSpecificationExecutor<Event> {

    // registration, cancellation and attendance serialize on the event row
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Event e where e.id = :id")
    Optional<Event> findByIdForUpdate(@Param("id") Long id);

    List<Event> findByClub_Id(Long clubId);

    List<Event> findByStatusIn(Collection<EventStatus> statuses);

    List<Event> findByStatusAndEventDateGreaterThanEqualOrderByEventDateAscStartTimeAsc(
            EventStatus status, LocalDate from, Pageable pageable);
}
