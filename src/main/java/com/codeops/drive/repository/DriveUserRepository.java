package com.codeops.drive.repository;

import com.codeops.drive.entity.DriveUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface DriveUserRepository extends JpaRepository<DriveUser, UUID> {

    List<DriveUser> findByActiveTrueOrderByFirstNameAscLastNameAsc();

    List<DriveUser> findByIdIn(Collection<UUID> ids);
}
