package com.postq;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TargetRepository extends JpaRepository<Target, String> {

    List<Target> findByActiveTrueOrderByTargetIdAsc();
}
