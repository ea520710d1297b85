package com.amumal.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;

import com.amumal.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserAccountRepository extends JpaRepository<UserAccount, Long>, UserAccountRepositoryCustom {

    Optional<UserAccount> findByEmailAndDeletedAtIsNull(String email);

    Optional<UserAccount> findByIdAndDeletedAtIsNull(Long id);

    boolean existsByEmailAndDeletedAtIsNull(String email);

    boolean existsByNicknameAndDeletedAtIsNull(String nickname);

    boolean existsByEmailAndDeletedAtIsNullAndIdNot(String email, Long id);

    boolean existsByNicknameAndDeletedAtIsNullAndIdNot(String nickname, Long id);
}
