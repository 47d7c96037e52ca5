package com.ninesync.mapper;

import com.ninesync.domain.StoredMessage;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface StoredMessageMapper {

    void upsert(StoredMessage message);

    StoredMessage findByUid(@Param("accountId") String accountId,
                            @Param("folderName") String folderName,
                            @Param("uid") long uid);

    List<Long> findUids(@Param("accountId") String accountId, @Param("folderName") String folderName);

    long countUnread(@Param("accountId") String accountId, @Param("folderName") String folderName);

    List<StoredMessage> findRecent(@Param("accountId") String accountId,
                                   @Param("folderName") String folderName,
                                   @Param("limit") int limit);

    int deleteByUids(@Param("accountId") String accountId,
                     @Param("folderName") String folderName,
                     @Param("uids") Collection<Long> uids);

    // Full-text index (FTS5 table message_index, rowid = stored_message.id)

    void deleteIndex(@Param("id") long id);

    void insertIndex(StoredMessage message);

    int deleteIndexByUids(@Param("accountId") String accountId,
                          @Param("folderName") String folderName,
                          @Param("uids") Collection<Long> uids);

    int deleteIndexByFolder(@Param("accountId") String accountId, @Param("folderName") String folderName);

    int insertIndexByFolder(@Param("accountId") String accountId, @Param("folderName") String folderName);

    List<StoredMessage> search(@Param("accountId") String accountId,
                               @Param("query") String query,
                               @Param("folders") List<String> folders,
                               @Param("limit") int limit);
}
