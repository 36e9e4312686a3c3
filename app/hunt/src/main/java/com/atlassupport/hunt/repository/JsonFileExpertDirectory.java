package com.atlassupport.hunt.repository;

import com.atlassupport.hunt.config.HuntStorageProperties;
import com.atlassupport.hunt.model.Expert;
import com.atlassupport.hunt.model.UserPriority;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Repository;

@Repository
public class JsonFileExpertDirectory implements ExpertDirectory {

  private final JsonFileCollection<Expert> experts;
  private final JsonFileCollection<UserPriority> userPriorities;

  @SuppressFBWarnings(
      value = "CT_CONSTRUCTOR_THROW",
      justification = "ファイル読み込み失敗時は起動を止めるため、コンストラクタからの例外送出を許容する")
  public JsonFileExpertDirectory(HuntStorageProperties properties, ObjectMapper objectMapper) {
    this.experts =
        new JsonFileCollection<>(properties.expertsPath(), objectMapper, Expert.class, Expert::id);
    this.userPriorities =
        new JsonFileCollection<>(
            properties.userPrioritiesPath(),
            objectMapper,
            UserPriority.class,
            UserPriority::userId);
  }

  @Override
  public Optional<Expert> findExpert(String expertId) {
    return experts.find(expertId);
  }

  @Override
  public Expert saveExpert(Expert expert) {
    return experts.put(expert);
  }

  @Override
  public List<Expert> listExperts() {
    return experts.listAll();
  }

  @Override
  public Optional<UserPriority> findUserPriority(String userId) {
    return userPriorities.find(userId);
  }

  @Override
  public UserPriority saveUserPriority(UserPriority userPriority) {
    return userPriorities.put(userPriority);
  }

  @Override
  public List<UserPriority> listUserPriorities() {
    return userPriorities.listAll();
  }
}
