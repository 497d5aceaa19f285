package com.len.admission.infra.booking;

import com.len.admission.domain.slot.Slot;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SlotJpaRepository extends JpaRepository<Slot, Long> {
}
