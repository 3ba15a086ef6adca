/**
 * 通信协议适配层：文本帧编解码、应答结构、HTTP 身份接口。
 * 只负责“服务器和客户端之间交换的消息结构”，不关心方块规则。
 *
 * <pre>
 * [客户端]  &lt;---- WebSocket 文本帧 / HTTP JSON ----&gt;  [transport 层]
 *         ↓
 *         [CommandRouter → GameEngine]
 * </pre>
 */
package com.blockhub.gameservice.platform.transport;
