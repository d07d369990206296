package org.mediacatalog.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mediacatalog.entity.Usr;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {
    private Long id;
    private String username;
    private String email;
    private Boolean active;
    private LocalDateTime createdAt;

    public static UserResponse from(Usr user) {
        return new UserResponse(user.getId(), user.getUsername(), user.getEmail(),
                user.getActive(), user.getCreatedAt());
    }
}
