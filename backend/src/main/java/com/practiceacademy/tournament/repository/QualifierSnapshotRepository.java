package com.practiceacademy.tournament.repository;

import com.practiceacademy.tournament.model.QualifierSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface QualifierSnapshotRepository extends JpaRepository<QualifierSnapshot, UUID> {
}
