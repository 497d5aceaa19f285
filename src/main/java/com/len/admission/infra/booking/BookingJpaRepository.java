package com.len.admission.infra.booking;

import com.len.admission.domain.booking.Booking;
import com.len.admission.domain.booking.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface BookingJpaRepository extends JpaRepository<Booking, Long> {

    long countBySlotIdAndStatusIn(Long slotId, Collection<BookingStatus> statuses);

    boolean existsByStudentIdAndSlotIdAndStatusIn(Long studentId, Long slotId, Collection<BookingStatus> statuses);

    List<Booking> findBySlotId(Long slotId);
}
