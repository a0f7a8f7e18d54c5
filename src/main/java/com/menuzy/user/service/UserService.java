package com.menuzy.user.service;

import com.menuzy.common.exception.BusinessException;
import com.menuzy.common.exception.ErrorCode;
import com.menuzy.user.dto.UserResponse;
import com.menuzy.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side for users. Users are only ever created through a catalog batch.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService {

    private final UserRepository userRepository;

    public UserResponse getUser(Long id) {
        return userRepository.findById(id)
                .map(UserResponse::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND,
                        "User " + id + " not found"));
    }
}
