package com.contextkit.core.identity;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class UserProfile {
    private String nickname;
    private String birthday;          // MM-dd, optional
    private String relationship;
    private String timezone;
    private String preferredLanguage;
    private List<String> customFacts;
}
